package com.purchasingpower.plangraph.exception;

import lombok.Getter;

/**
 * Root of the analyzer/synthesizer failure hierarchy.
 *
 * <p>{@code nodeName} names the task or worker class the failure belongs to, when known.
 */
@Getter
public class PipelineTransformException extends RuntimeException {

    private final String nodeName;

    public PipelineTransformException(String message) {
        this(message, null, null);
    }

    public PipelineTransformException(String message, String nodeName) {
        this(message, nodeName, null);
    }

    public PipelineTransformException(String message, String nodeName, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }
}

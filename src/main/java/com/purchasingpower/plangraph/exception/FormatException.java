package com.purchasingpower.plangraph.exception;

import lombok.Getter;

/**
 * Generated text could not be brought into canonical form. Carries the unformatted text.
 */
@Getter
public class FormatException extends PipelineTransformException {

    private final String rawSource;

    public FormatException(String message, String rawSource, Throwable cause) {
        super(message, null, cause);
        this.rawSource = rawSource;
    }
}

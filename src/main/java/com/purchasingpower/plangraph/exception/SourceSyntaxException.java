package com.purchasingpower.plangraph.exception;

import lombok.Getter;

@Getter
public class SourceSyntaxException extends PipelineTransformException {

    private final String sourceName;
    private final int line;
    private final int column;

    public SourceSyntaxException(String message, String sourceName, int line, int column) {
        super(String.format("%s (%s, line %d, column %d)", message, sourceName, line, column));
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }
}

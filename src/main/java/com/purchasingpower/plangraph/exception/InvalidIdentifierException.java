package com.purchasingpower.plangraph.exception;

import lombok.Getter;

@Getter
public class InvalidIdentifierException extends PipelineTransformException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String role, String nodeName) {
        super("Invalid " + role + " name: '" + identifier + "'", nodeName);
        this.identifier = identifier;
    }
}

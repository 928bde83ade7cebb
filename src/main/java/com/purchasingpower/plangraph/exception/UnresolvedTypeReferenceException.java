package com.purchasingpower.plangraph.exception;

import lombok.Getter;

@Getter
public class UnresolvedTypeReferenceException extends PipelineTransformException {

    private final String typeName;

    public UnresolvedTypeReferenceException(String typeName, String nodeName) {
        super("Unresolved type reference: '" + typeName + "'", nodeName);
        this.typeName = typeName;
    }
}

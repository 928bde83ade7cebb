package com.purchasingpower.plangraph.service.analysis;

import java.util.List;

/**
 * A type annotation reduced to the shape the editor understands.
 *
 * @param typeName      primitive tag, task class name, {@code literal}, or annotation text
 * @param list          the annotation was {@code List[...]}
 * @param literalValues allowed values when {@code typeName} is {@code literal}, else null
 * @param optional      the annotation was {@code Optional[...]}
 */
public record DecodedAnnotation(String typeName, boolean list, List<String> literalValues, boolean optional) {

    public boolean isLiteral() {
        return literalValues != null;
    }
}

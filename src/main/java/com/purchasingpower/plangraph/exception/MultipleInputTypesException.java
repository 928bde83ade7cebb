package com.purchasingpower.plangraph.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class MultipleInputTypesException extends PipelineTransformException {

    private final List<String> inputTypes;

    public MultipleInputTypesException(String workerName, List<String> inputTypes) {
        super("Worker " + workerName + " declares multiple input types " + inputTypes
                + " but is not a join worker", workerName);
        this.inputTypes = List.copyOf(inputTypes);
    }
}

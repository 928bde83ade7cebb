package com.purchasingpower.plangraph.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.plangraph.model.ir.PipelineDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of analyzing one source text.
 *
 * <p>A failed analysis still carries an (empty) definition so callers can render something.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {

    PipelineDefinition definition;

    ErrorDescriptor error;

    /** Units skipped during analysis, one message each. */
    @Builder.Default
    List<String> warnings = List.of();

    public static AnalysisResult success(PipelineDefinition definition, List<String> warnings) {
        return AnalysisResult.builder()
                .definition(definition)
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static AnalysisResult failure(ErrorDescriptor error) {
        return AnalysisResult.builder()
                .definition(PipelineDefinition.empty())
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}

package com.purchasingpower.plangraph.model.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Tri-state export result: either source text and module name, or an error. Never both.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SynthesisResult {

    String sourceText;

    String moduleName;

    ErrorDescriptor error;

    @Builder.Default
    List<String> warnings = List.of();

    public static SynthesisResult success(String sourceText, String moduleName, List<String> warnings) {
        return SynthesisResult.builder()
                .sourceText(sourceText)
                .moduleName(moduleName)
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static SynthesisResult failure(ErrorDescriptor error) {
        return SynthesisResult.builder()
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}

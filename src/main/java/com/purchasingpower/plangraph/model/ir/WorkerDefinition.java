package com.purchasingpower.plangraph.model.ir;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A processing node of the pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerDefinition {

    private String className;

    @JsonAlias("workerType")
    private WorkerVariant variantKind;

    @Builder.Default
    private WorkerClassVars classVars = new WorkerClassVars();

    /** Recognized lifecycle hooks: method name to exact source (decorators included). */
    @Builder.Default
    private Map<String, String> methods = new LinkedHashMap<>();

    /** All other class-body members, dedented and separated by blank lines. */
    @JsonAlias("otherMembersSource")
    private String rawPassthroughSource;

    /** Null when the input type could not be inferred; never an empty list. */
    private List<String> inputTypes;

    private String variableName;

    private boolean entryPoint;

    private String factoryFunction;

    /** Verbatim argument text of the factory call, arguments joined with ", ". */
    private String factoryInvocation;

    private Map<String, LlmConfigValue> llmConfigFromCode;

    private String llmConfigVar;

    public String firstInputType() {
        return inputTypes == null || inputTypes.isEmpty() ? null : inputTypes.get(0);
    }
}

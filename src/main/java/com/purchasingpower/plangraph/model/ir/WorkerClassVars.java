package com.purchasingpower.plangraph.model.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Recognized class-level variables of a worker, keyed by their Python names on the wire.
 * Unset entries are absent from the JSON form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerClassVars {

    @JsonProperty("output_types")
    private List<String> outputTypes;

    @JsonProperty("input_type")
    private String inputType;

    @JsonProperty("llm_input_type")
    private String llmInputType;

    @JsonProperty("llm_output_type")
    private String llmOutputType;

    /** Prompt text after {@code dedent}, without the {@code .strip()} applied at runtime. */
    private String prompt;

    @JsonProperty("system_prompt")
    private String systemPrompt;

    @JsonProperty("debug_mode")
    private Boolean debugMode;

    @JsonProperty("use_xml")
    private Boolean useXml;

    @JsonProperty("join_type")
    private String joinType;

    private List<String> tools;
}

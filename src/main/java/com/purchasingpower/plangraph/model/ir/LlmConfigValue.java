package com.purchasingpower.plangraph.model.ir;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One keyword argument of an {@code llm_from_config(...)} call.
 *
 * <p>Literal arguments keep their Python value (string, number, boolean or null); anything
 * else keeps its source text with {@code is_literal = false}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LlmConfigValue {

    private Object value;

    @JsonProperty("is_literal")
    private boolean literal;

    public static LlmConfigValue literal(Object value) {
        return new LlmConfigValue(value, true);
    }

    public static LlmConfigValue expression(String sourceText) {
        return new LlmConfigValue(sourceText, false);
    }
}

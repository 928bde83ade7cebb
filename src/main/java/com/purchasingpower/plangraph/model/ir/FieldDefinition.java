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
 * A field of a Task class.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldDefinition {

    public static final String LITERAL_TYPE = "literal";

    private String name;

    /**
     * Primitive tag ({@code string}, {@code integer}, {@code float}, {@code boolean}), a task
     * class name, {@value #LITERAL_TYPE}, or annotation text kept verbatim.
     */
    private String type;

    @JsonProperty("isList")
    private boolean list;

    /** False when the annotation is Optional-wrapped or the declared default is None. */
    @Builder.Default
    private boolean required = true;

    private String description;

    /** Only set when {@code type} is {@value #LITERAL_TYPE}. */
    private List<String> literalValues;
}

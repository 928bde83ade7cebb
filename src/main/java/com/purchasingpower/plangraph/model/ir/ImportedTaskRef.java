package com.purchasingpower.plangraph.model.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A Task class imported from an allowed module rather than declared locally.
 *
 * <p>{@code implicit} refs were not imported by the source itself but are needed because a
 * factory-created worker consumes or produces them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImportedTaskRef {

    private String modulePath;

    private String className;

    @JsonProperty("isImplicit")
    private boolean implicit;
}

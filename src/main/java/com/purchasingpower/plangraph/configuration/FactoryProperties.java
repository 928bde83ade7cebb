package com.purchasingpower.plangraph.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A registered sub-graph factory function, e.g. {@code create_planning_worker}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FactoryProperties {

    @NotBlank(message = "Factory function name is required")
    private String name;

    /** Module the factory function is imported from. */
    @NotBlank
    private String module = "planai.patterns";

    /** Class name used when the call has no {@code name=} keyword. */
    @NotBlank
    private String defaultClassName;

    @NotEmpty
    private List<String> inputTypes = new ArrayList<>();

    @NotEmpty
    private List<String> outputTypes = new ArrayList<>();

    /** Module the factory's task types live in, for implicit imports. */
    @NotBlank
    private String taskModule = "planai.patterns";
}

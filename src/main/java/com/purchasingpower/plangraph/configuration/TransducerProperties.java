package com.purchasingpower.plangraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static tables of the pipeline framework vocabulary, bound from {@code plangraph.*}.
 *
 * <p>Field initializers carry the stock PlanAI values so unit tests can use {@code new}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "plangraph")
public class TransducerProperties {

    /** Module name suggested for generated source. */
    @NotBlank
    private String moduleName = "generated_plan";

    /** {@code name=} passed to {@code Graph(...)} in generated source. */
    @NotBlank
    private String graphName = "GeneratedPlan";

    /**
     * Modules whose Task classes may be imported, with the class names allowed from each.
     * Keys contain dots, so YAML needs the bracket form: {@code "[planai.patterns]"}.
     */
    @NotEmpty
    private Map<String, List<String>> allowedTaskImports = defaultAllowedTaskImports();

    @Valid
    @NotEmpty
    private List<FactoryProperties> factories = defaultFactories();

    private static Map<String, List<String>> defaultAllowedTaskImports() {
        Map<String, List<String>> imports = new LinkedHashMap<>();
        imports.put("planai.patterns",
                new ArrayList<>(List.of("ConsolidatedPages", "SearchQuery", "SearchResult", "FinalPlan", "PlanRequest")));
        imports.put("planai.patterns.planner", new ArrayList<>(List.of("PlanRequest", "FinalPlan")));
        imports.put("planai.patterns.search_fetcher", new ArrayList<>(List.of("SearchQuery", "SearchResult")));
        return imports;
    }

    private static List<FactoryProperties> defaultFactories() {
        List<FactoryProperties> factories = new ArrayList<>();
        factories.add(new FactoryProperties("create_planning_worker", "planai.patterns", "PlanningWorkerSubgraph",
                new ArrayList<>(List.of("PlanRequest")), new ArrayList<>(List.of("FinalPlan")), "planai.patterns"));
        factories.add(new FactoryProperties("create_search_fetch_worker", "planai.patterns", "SearchFetchWorker",
                new ArrayList<>(List.of("SearchQuery")), new ArrayList<>(List.of("ConsolidatedPages")), "planai.patterns"));
        return factories;
    }
}

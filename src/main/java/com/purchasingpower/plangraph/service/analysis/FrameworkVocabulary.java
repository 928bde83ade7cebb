package com.purchasingpower.plangraph.service.analysis;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.purchasingpower.plangraph.configuration.FactoryProperties;
import com.purchasingpower.plangraph.configuration.TransducerProperties;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The framework names the analyzer recognizes and the synthesizer emits.
 *
 * <p>Fixed names (base classes, hooks, classvars) are constants; the import allow-list and the
 * factory registry come from {@link TransducerProperties}. Instances are immutable and shared.
 */
public class FrameworkVocabulary {

    public static final String TASK_BASE_CLASS = "Task";
    public static final String GRAPH_CLASS = "Graph";
    public static final String GRAPH_VARIABLE = "graph";
    public static final String LLM_CONFIG_BUILDER = "llm_from_config";

    public static final String CONSUME_WORK = "consume_work";
    public static final String CONSUME_WORK_JOINED = "consume_work_joined";

    /** Recognized lifecycle hooks, in canonical emission order. */
    public static final ImmutableList<String> KNOWN_METHODS = ImmutableList.of(
            CONSUME_WORK, CONSUME_WORK_JOINED, "pre_consume_work", "pre_process", "format_prompt",
            "extra_validation", "post_process", "extra_cache_key");

    public static final ImmutableSet<String> KNOWN_CLASS_VARS = ImmutableSet.of(
            "output_types", "input_type", "llm_input_type", "llm_output_type", "prompt",
            "system_prompt", "debug_mode", "use_xml", "join_type", "tools");

    /** Receivers accepted for graph wiring calls. */
    public static final ImmutableSet<String> GRAPH_RECEIVERS = ImmutableSet.of(GRAPH_VARIABLE, "g");

    public static final ImmutableSet<String> GRAPH_METHODS = ImmutableSet.of(
            "add_workers", "set_dependency", "set_entry", "set_sink", "run");

    /** Python annotation name to editor primitive tag. */
    public static final ImmutableBiMap<String, String> PRIMITIVE_TAGS = ImmutableBiMap.of(
            "str", "string",
            "int", "integer",
            "float", "float",
            "bool", "boolean");

    private final String moduleName;
    private final String graphName;
    private final ImmutableSetMultimap<String, String> allowedTaskImports;
    private final ImmutableMap<String, FactorySpec> factories;

    public FrameworkVocabulary(TransducerProperties properties) {
        Preconditions.checkNotNull(properties, "properties");
        this.moduleName = properties.getModuleName();
        this.graphName = properties.getGraphName();

        ImmutableSetMultimap.Builder<String, String> imports = ImmutableSetMultimap.builder();
        for (Map.Entry<String, List<String>> entry : properties.getAllowedTaskImports().entrySet()) {
            imports.putAll(entry.getKey(), entry.getValue());
        }
        this.allowedTaskImports = imports.build();

        ImmutableMap.Builder<String, FactorySpec> factoryTable = ImmutableMap.builder();
        for (FactoryProperties factory : properties.getFactories()) {
            factoryTable.put(factory.getName(), new FactorySpec(
                    factory.getName(),
                    factory.getModule(),
                    factory.getDefaultClassName(),
                    ImmutableList.copyOf(factory.getInputTypes()),
                    ImmutableList.copyOf(factory.getOutputTypes()),
                    factory.getTaskModule()));
        }
        this.factories = factoryTable.buildOrThrow();
    }

    public String moduleName() {
        return moduleName;
    }

    public String graphName() {
        return graphName;
    }

    public boolean isAllowedTaskImport(String module, String className) {
        return module != null && allowedTaskImports.containsEntry(module, className);
    }

    public Optional<FactorySpec> factory(String name) {
        return Optional.ofNullable(factories.get(name));
    }

    public ImmutableMap<String, FactorySpec> factories() {
        return factories;
    }

    public static boolean isKnownMethod(String name) {
        return KNOWN_METHODS.contains(name);
    }

    public static boolean isKnownClassVar(String name) {
        return KNOWN_CLASS_VARS.contains(name);
    }
}

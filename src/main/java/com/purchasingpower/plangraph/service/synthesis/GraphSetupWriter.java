package com.purchasingpower.plangraph.service.synthesis;

import com.purchasingpower.plangraph.model.ir.LlmConfigValue;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.service.analysis.FactorySpec;
import com.purchasingpower.plangraph.service.analysis.FrameworkVocabulary;
import com.purchasingpower.plangraph.util.PythonLiterals;
import com.purchasingpower.plangraph.util.PythonText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes the body of {@code create_graph()}: one guarded instantiation per worker, then the
 * {@code add_workers}, {@code set_dependency} and {@code set_entry} calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphSetupWriter {

    static final String INSTANTIATION_SNIPPET = "instantiation";

    private static final String INDENT = "    ";
    private static final Pattern NAME_KEYWORD = Pattern.compile("\\bname\\s*=");

    private final CodeSnippetLibrary snippetLibrary;
    private final FrameworkVocabulary vocabulary;

    /**
     * @param workerInstantiation guarded instantiation blocks, indented for the builder body
     * @param dependencySetup     wiring calls, indented for the builder body; empty when there are no workers
     */
    public record GraphSetup(String workerInstantiation, String dependencySetup) {
    }

    public static String instanceName(String className) {
        return className.toLowerCase() + "_worker";
    }

    /**
     * Variable name per worker class. Class names that differ only in case get a numeric
     * suffix ({@code abworker_worker}, {@code abworker_2_worker}); names never shadow a class,
     * an LLM variable or the graph variable.
     */
    static Map<String, String> instanceNames(List<WorkerDefinition> workers) {
        Set<String> taken = new HashSet<>();
        taken.add(FrameworkVocabulary.GRAPH_VARIABLE);
        for (WorkerDefinition worker : workers) {
            taken.add(worker.getClassName());
            if (worker.getLlmConfigVar() != null) {
                taken.add(worker.getLlmConfigVar());
            }
        }
        Map<String, String> names = new LinkedHashMap<>();
        for (WorkerDefinition worker : workers) {
            String base = worker.getClassName().toLowerCase();
            String candidate = instanceName(worker.getClassName());
            for (int suffix = 2; taken.contains(candidate); suffix++) {
                candidate = base + "_" + suffix + "_worker";
            }
            taken.add(candidate);
            names.put(worker.getClassName(), candidate);
        }
        return names;
    }

    public GraphSetup write(SynthesisPlan plan, List<String> warnings) {
        Map<String, String> instances = instanceNames(plan.workers());
        Set<String> declaredLlmVars = new HashSet<>();
        List<String> blocks = new ArrayList<>();
        for (WorkerDefinition worker : plan.workers()) {
            String instance = instances.get(worker.getClassName());
            List<String> statements = worker.getFactoryFunction() != null
                    ? factoryStatements(worker, instance, declaredLlmVars, warnings)
                    : constructorStatements(worker, instance, declaredLlmVars, warnings);
            Map<String, Object> variables = Map.of(
                    "statements", PythonText.indentCode(String.join("\n", statements), INDENT),
                    "message", PythonLiterals.quote("Failed to instantiate " + worker.getClassName()),
                    "nodeName", PythonLiterals.quote(worker.getClassName()));
            blocks.add(snippetLibrary.render(INSTANTIATION_SNIPPET, variables).strip());
        }
        String instantiation = PythonText.indentCode(String.join("\n\n", blocks), INDENT);
        return new GraphSetup(instantiation, PythonText.indentCode(wiring(plan, instances), INDENT));
    }

    private List<String> constructorStatements(WorkerDefinition worker, String instance,
                                               Set<String> declaredLlmVars, List<String> warnings) {
        List<String> statements = new ArrayList<>();
        Optional<String> llm = llmArgument(worker, statements, declaredLlmVars, warnings);
        statements.add(instance + " = " + worker.getClassName()
                + "(" + llm.map(value -> "llm=" + value).orElse("") + ")");
        return statements;
    }

    private List<String> factoryStatements(WorkerDefinition worker, String instance,
                                           Set<String> declaredLlmVars, List<String> warnings) {
        List<String> statements = new ArrayList<>();
        declareLlmVariable(worker, statements, declaredLlmVars);

        String invocation = worker.getFactoryInvocation() == null ? "" : worker.getFactoryInvocation().strip();
        String defaultClass = vocabulary.factory(worker.getFactoryFunction())
                .map(FactorySpec::defaultClassName)
                .orElse(null);
        if (defaultClass == null) {
            warnings.add("Factory function " + worker.getFactoryFunction() + " of worker "
                    + worker.getClassName() + " is not registered");
        }
        if (!worker.getClassName().equals(defaultClass) && !NAME_KEYWORD.matcher(invocation).find()) {
            String name = "name=" + PythonLiterals.quote(worker.getClassName());
            invocation = invocation.isEmpty() ? name : invocation + ", " + name;
        }
        statements.add(instance + " = " + worker.getFactoryFunction() + "(" + invocation + ")");
        return statements;
    }

    /**
     * Value of the {@code llm=} argument, adding the shared variable assignment to
     * {@code statements} the first time a variable is used.
     */
    private Optional<String> llmArgument(WorkerDefinition worker, List<String> statements,
                                         Set<String> declaredLlmVars, List<String> warnings) {
        String variable = worker.getLlmConfigVar();
        Map<String, LlmConfigValue> config = worker.getLlmConfigFromCode();
        if (variable != null && config != null) {
            declareLlmVariable(worker, statements, declaredLlmVars);
            return Optional.of(variable);
        }
        if (config != null) {
            return Optional.of(configCall(config));
        }
        if (variable != null) {
            warnings.add("LLM variable " + variable + " of worker " + worker.getClassName()
                    + " has no configuration; passing llm=None");
            return Optional.of("None");
        }
        if (worker.getVariantKind() != null && worker.getVariantKind().requiresLlm()) {
            return Optional.of("None");
        }
        return Optional.empty();
    }

    private static void declareLlmVariable(WorkerDefinition worker, List<String> statements, Set<String> declared) {
        String variable = worker.getLlmConfigVar();
        if (variable != null && worker.getLlmConfigFromCode() != null && declared.add(variable)) {
            statements.add(variable + " = " + configCall(worker.getLlmConfigFromCode()));
        }
    }

    static String configCall(Map<String, LlmConfigValue> config) {
        String arguments = config.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + render(entry.getValue()))
                .collect(Collectors.joining(", "));
        return FrameworkVocabulary.LLM_CONFIG_BUILDER + "(" + arguments + ")";
    }

    private static String render(LlmConfigValue value) {
        if (value == null) {
            return "None";
        }
        return value.isLiteral() ? PythonLiterals.literal(value.getValue()) : String.valueOf(value.getValue());
    }

    private static String wiring(SynthesisPlan plan, Map<String, String> instances) {
        if (plan.workers().isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        lines.add(FrameworkVocabulary.GRAPH_VARIABLE + ".add_workers("
                + plan.workers().stream()
                        .map(worker -> instances.get(worker.getClassName()))
                        .collect(Collectors.joining(", "))
                + ")");
        for (WorkerEdge edge : plan.dependencies()) {
            lines.add(FrameworkVocabulary.GRAPH_VARIABLE + ".set_dependency("
                    + instance(instances, edge.getSource()) + ", " + instance(instances, edge.getTarget()) + ")");
        }
        for (WorkerDefinition worker : plan.workers()) {
            if (plan.entryWorkers().contains(worker.getClassName())) {
                lines.add(FrameworkVocabulary.GRAPH_VARIABLE + ".set_entry(" + instances.get(worker.getClassName()) + ")");
            }
        }
        return String.join("\n", lines);
    }

    private static String instance(Map<String, String> instances, String className) {
        return instances.getOrDefault(className, instanceName(className));
    }
}

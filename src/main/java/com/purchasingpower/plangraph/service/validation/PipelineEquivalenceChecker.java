package com.purchasingpower.plangraph.service.validation;

import com.google.common.collect.Sets;
import com.purchasingpower.plangraph.model.ir.EntryEdge;
import com.purchasingpower.plangraph.model.ir.FieldDefinition;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.LlmConfigValue;
import com.purchasingpower.plangraph.model.ir.PipelineDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerClassVars;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.result.EquivalenceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Structural comparison of two pipeline definitions.
 *
 * <p>Method bodies, passthrough text, descriptions and variable names are not compared.
 * Output types and edges compare as sets, prompts after stripping surrounding whitespace,
 * numbers by value.
 */
@Slf4j
@Component
public class PipelineEquivalenceChecker {

    public EquivalenceReport compare(PipelineDefinition expected, PipelineDefinition actual) {
        List<String> differences = new ArrayList<>();
        compareTasks(expected.getTasks(), actual.getTasks(), differences);
        compareWorkers(expected.getWorkers(), actual.getWorkers(), differences);

        compareSets("edges",
                edgeKeys(expected.getEdges()), edgeKeys(actual.getEdges()), differences);
        compareSets("entry edges",
                entryKeys(expected.getEntryEdges()), entryKeys(actual.getEntryEdges()), differences);
        compareSets("imported tasks",
                importKeys(expected.getImportedTasks()), importKeys(actual.getImportedTasks()), differences);

        EquivalenceReport report = EquivalenceReport.of(differences);
        log.debug("Equivalence check: {}", report.getSummary());
        return report;
    }

    private static void compareTasks(List<TaskDefinition> expected, List<TaskDefinition> actual,
                                     List<String> differences) {
        Map<String, TaskDefinition> left = byName(expected, TaskDefinition::getClassName);
        Map<String, TaskDefinition> right = byName(actual, TaskDefinition::getClassName);
        compareSets("tasks", left.keySet(), right.keySet(), differences);

        for (String name : Sets.intersection(left.keySet(), right.keySet())) {
            Map<String, FieldDefinition> leftFields = byName(left.get(name).getFields(), FieldDefinition::getName);
            Map<String, FieldDefinition> rightFields = byName(right.get(name).getFields(), FieldDefinition::getName);
            compareSets("fields of task " + name, leftFields.keySet(), rightFields.keySet(), differences);

            for (String field : Sets.intersection(leftFields.keySet(), rightFields.keySet())) {
                FieldDefinition a = leftFields.get(field);
                FieldDefinition b = rightFields.get(field);
                String path = "task " + name + "." + field;
                check(path + " type", a.getType(), b.getType(), differences);
                check(path + " isList", a.isList(), b.isList(), differences);
                check(path + " required", a.isRequired(), b.isRequired(), differences);
                check(path + " literalValues", a.getLiteralValues(), b.getLiteralValues(), differences);
            }
        }
    }

    private static void compareWorkers(List<WorkerDefinition> expected, List<WorkerDefinition> actual,
                                       List<String> differences) {
        Map<String, WorkerDefinition> left = byName(expected, WorkerDefinition::getClassName);
        Map<String, WorkerDefinition> right = byName(actual, WorkerDefinition::getClassName);
        compareSets("workers", left.keySet(), right.keySet(), differences);

        for (String name : Sets.intersection(left.keySet(), right.keySet())) {
            WorkerDefinition a = left.get(name);
            WorkerDefinition b = right.get(name);
            String path = "worker " + name;
            check(path + " variant", a.getVariantKind(), b.getVariantKind(), differences);
            compareClassVars(path, orEmpty(a.getClassVars()), orEmpty(b.getClassVars()), differences);
            check(path + " factoryFunction", a.getFactoryFunction(), b.getFactoryFunction(), differences);
            check(path + " factoryInvocation", a.getFactoryInvocation(), b.getFactoryInvocation(), differences);
            compareLlmConfig(path, a.getLlmConfigFromCode(), b.getLlmConfigFromCode(), differences);
            if (a.getLlmConfigVar() != null && b.getLlmConfigVar() != null) {
                check(path + " llmConfigVar", a.getLlmConfigVar(), b.getLlmConfigVar(), differences);
            }
        }
    }

    private static void compareClassVars(String path, WorkerClassVars a, WorkerClassVars b, List<String> differences) {
        check(path + " output_types", asSet(a.getOutputTypes()), asSet(b.getOutputTypes()), differences);
        check(path + " llm_input_type", a.getLlmInputType(), b.getLlmInputType(), differences);
        check(path + " llm_output_type", a.getLlmOutputType(), b.getLlmOutputType(), differences);
        check(path + " join_type", a.getJoinType(), b.getJoinType(), differences);
        check(path + " use_xml", a.getUseXml(), b.getUseXml(), differences);
        check(path + " debug_mode", a.getDebugMode(), b.getDebugMode(), differences);
        check(path + " prompt", strip(a.getPrompt()), strip(b.getPrompt()), differences);
        check(path + " system_prompt", strip(a.getSystemPrompt()), strip(b.getSystemPrompt()), differences);
    }

    private static void compareLlmConfig(String path, Map<String, LlmConfigValue> a, Map<String, LlmConfigValue> b,
                                         List<String> differences) {
        if (a == null || b == null) {
            if (a != b) {
                differences.add(path + " llmConfigFromCode: " + (a == null ? "absent" : "present")
                        + " vs " + (b == null ? "absent" : "present"));
            }
            return;
        }
        compareSets(path + " llmConfigFromCode keys", a.keySet(), b.keySet(), differences);
        for (String key : Sets.intersection(a.keySet(), b.keySet())) {
            LlmConfigValue left = a.get(key);
            LlmConfigValue right = b.get(key);
            String keyPath = path + " llmConfigFromCode." + key;
            check(keyPath + " is_literal", left.isLiteral(), right.isLiteral(), differences);
            if (!valuesEqual(left.getValue(), right.getValue())) {
                differences.add(keyPath + ": " + left.getValue() + " vs " + right.getValue());
            }
        }
    }

    /** Numbers compare by value: JSON round trips turn longs into ints and back. */
    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
        }
        return Objects.equals(a, b);
    }

    private static void check(String path, Object a, Object b, List<String> differences) {
        if (!Objects.equals(a, b)) {
            differences.add(path + ": " + a + " vs " + b);
        }
    }

    private static <T extends Comparable<T>> void compareSets(String what, Set<T> a, Set<T> b, List<String> differences) {
        Set<T> missing = new TreeSet<>(Sets.difference(a, b));
        Set<T> extra = new TreeSet<>(Sets.difference(b, a));
        if (!missing.isEmpty()) {
            differences.add(what + " missing: " + missing);
        }
        if (!extra.isEmpty()) {
            differences.add(what + " unexpected: " + extra);
        }
    }

    private static <T> Map<String, T> byName(List<T> items, Function<T, String> name) {
        Map<String, T> map = new LinkedHashMap<>();
        if (items != null) {
            items.forEach(item -> map.putIfAbsent(name.apply(item), item));
        }
        return map;
    }

    private static Set<String> edgeKeys(List<WorkerEdge> edges) {
        return keys(edges, edge -> edge.getSource() + " -> " + edge.getTarget());
    }

    private static Set<String> entryKeys(List<EntryEdge> edges) {
        return keys(edges, edge -> edge.getSourceTask() + " -> " + edge.getTargetWorker());
    }

    private static Set<String> importKeys(List<ImportedTaskRef> imports) {
        return keys(imports, ref -> ref.getModulePath() + "." + ref.getClassName());
    }

    private static <T> Set<String> keys(List<T> items, Function<T, String> key) {
        return items == null ? Set.of() : items.stream().map(key).collect(Collectors.toCollection(HashSet::new));
    }

    private static Set<String> asSet(List<String> values) {
        return values == null ? null : new HashSet<>(values);
    }

    private static String strip(String text) {
        return text == null ? null : text.strip();
    }

    private static WorkerClassVars orEmpty(WorkerClassVars vars) {
        return vars == null ? new WorkerClassVars() : vars;
    }
}

package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.EntryEdge;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.WorkerClassVars;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recovers graph wiring from the graph builder function: which variables hold which workers,
 * the dependency edges between them and the entry points.
 *
 * <p>The graph builder is the first function, in breadth-first order over the module, whose
 * own body assigns {@code graph = Graph(...)} and which calls one of the graph wiring methods.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopologyExtractor {

    private static final String SET_DEPENDENCY = "set_dependency";
    private static final String NEXT = "next";
    private static final String SET_ENTRY = "set_entry";
    private static final String RUN = "run";
    private static final String INITIAL_TASKS = "initial_tasks";

    private final FrameworkVocabulary vocabulary;

    /**
     * @param localWorkers workers declared in the module by class name; their
     *                     {@code variableName} and {@code entryPoint} are filled in
     * @param warnings     receives one message per skipped binding
     */
    public PipelineTopology extract(PythonSyntaxTree tree, Map<String, WorkerDefinition> localWorkers,
                                    List<String> warnings) {
        Optional<TSNode> builder = findGraphBuilder(tree);
        if (builder.isEmpty()) {
            log.debug("No graph builder function found, topology is empty");
            return PipelineTopology.empty();
        }
        TSNode function = builder.get();
        log.debug("Graph builder function: {}", tree.definitionName(function));

        Map<String, WorkerBinding> bindings = collectBindings(function, localWorkers.keySet(), tree);

        Map<String, WorkerDefinition> allWorkers = new LinkedHashMap<>(localWorkers);
        List<WorkerDefinition> factoryWorkers = new ArrayList<>();
        for (WorkerBinding binding : bindings.values()) {
            if (!binding.isFactory()) {
                localWorkers.get(binding.className()).setVariableName(binding.variable());
                continue;
            }
            if (allWorkers.containsKey(binding.className())) {
                warnings.add("Factory worker " + binding.className() + " bound to '" + binding.variable()
                        + "' duplicates an existing worker class; skipped");
                continue;
            }
            WorkerDefinition factoryWorker = factoryWorker(binding, tree);
            factoryWorkers.add(factoryWorker);
            allWorkers.put(factoryWorker.getClassName(), factoryWorker);
        }

        List<TSNode> statements = flatten(SyntaxNodes.body(function));
        List<WorkerEdge> edges = new ArrayList<>();
        List<EntryEdge> entries = new ArrayList<>();
        for (TSNode statement : statements) {
            edges.addAll(chainEdges(statement, bindings, allWorkers, tree));
            entries.addAll(setEntryEdges(statement, bindings, allWorkers, tree));
            entries.addAll(runEntryEdges(statement, bindings, function, tree));
        }

        List<EntryEdge> uniqueEntries = dedupe(entries);
        for (EntryEdge entry : uniqueEntries) {
            WorkerDefinition target = allWorkers.get(entry.getTargetWorker());
            if (target != null) {
                target.setEntryPoint(true);
            }
        }

        log.debug("Topology: {} binding(s), {} edge(s), {} entry edge(s)",
                bindings.size(), edges.size(), uniqueEntries.size());
        return new PipelineTopology(function, Collections.unmodifiableMap(bindings), factoryWorkers, edges, uniqueEntries);
    }

    /** First {@code function_definition}, breadth-first over the module, that builds and wires a graph. */
    public Optional<TSNode> findGraphBuilder(PythonSyntaxTree tree) {
        for (TSNode node : SyntaxNodes.walk(tree.root())) {
            if (SyntaxNodes.is(node, SyntaxNodes.FUNCTION_DEFINITION)
                    && assignsGraph(node, tree) && callsGraphMethod(node, tree)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private static boolean assignsGraph(TSNode function, PythonSyntaxTree tree) {
        for (TSNode statement : SyntaxNodes.body(function)) {
            TSNode assignment = SyntaxNodes.assignment(statement);
            TSNode value = SyntaxNodes.assignedValue(assignment);
            if (assignment != null
                    && FrameworkVocabulary.GRAPH_VARIABLE.equals(tree.name(SyntaxNodes.singleTarget(assignment)))
                    && SyntaxNodes.is(value, SyntaxNodes.CALL)
                    && FrameworkVocabulary.GRAPH_CLASS.equals(tree.name(SyntaxNodes.field(value, "function")))) {
                return true;
            }
        }
        return false;
    }

    private static boolean callsGraphMethod(TSNode function, PythonSyntaxTree tree) {
        for (TSNode call : SyntaxNodes.findAllDescendants(function, SyntaxNodes.CALL)) {
            TSNode callee = SyntaxNodes.unwrap(SyntaxNodes.field(call, "function"));
            if (SyntaxNodes.is(callee, SyntaxNodes.ATTRIBUTE)
                    && FrameworkVocabulary.GRAPH_RECEIVERS.contains(tree.name(SyntaxNodes.field(callee, "object")))
                    && FrameworkVocabulary.GRAPH_METHODS.contains(tree.attributeName(callee))) {
                return true;
            }
        }
        return false;
    }

    Map<String, WorkerBinding> collectBindings(TSNode function, Set<String> localWorkerClasses, PythonSyntaxTree tree) {
        Map<String, WorkerBinding> bindings = new LinkedHashMap<>();
        for (TSNode statement : flatten(SyntaxNodes.body(function))) {
            TSNode assignment = SyntaxNodes.assignment(statement);
            String target = assignment == null ? null : tree.name(SyntaxNodes.singleTarget(assignment));
            TSNode call = SyntaxNodes.assignedValue(assignment);
            if (target == null || !SyntaxNodes.is(call, SyntaxNodes.CALL)) {
                continue;
            }
            String callee = tree.calleeName(call);
            if (callee == null) {
                continue;
            }
            if (localWorkerClasses.contains(callee)) {
                bindings.put(target, new WorkerBinding(target, callee, call, null));
            } else {
                Optional<FactorySpec> factory = vocabulary.factory(callee);
                if (factory.isPresent()) {
                    String className = tree.keyword(call, "name")
                            .flatMap(tree::stringValue)
                            .orElse(factory.get().defaultClassName());
                    bindings.put(target, new WorkerBinding(target, className, call, factory.get()));
                }
            }
        }
        return bindings;
    }

    private static WorkerDefinition factoryWorker(WorkerBinding binding, PythonSyntaxTree tree) {
        FactorySpec factory = binding.factory();
        String invocation = SyntaxNodes.arguments(binding.call()).stream()
                .map(tree::text)
                .collect(Collectors.joining(", "));
        return WorkerDefinition.builder()
                .className(binding.className())
                .variantKind(WorkerVariant.SUBGRAPH_WORKER)
                .variableName(binding.variable())
                .inputTypes(new ArrayList<>(factory.inputTypes()))
                .classVars(WorkerClassVars.builder()
                        .outputTypes(new ArrayList<>(factory.outputTypes()))
                        .build())
                .factoryFunction(factory.name())
                .factoryInvocation(invocation)
                .build();
    }

    /**
     * Replays {@code graph.set_dependency(a, b).next(c)...} left to right. A link whose
     * variables do not resolve breaks the chain.
     */
    List<WorkerEdge> chainEdges(TSNode statement, Map<String, WorkerBinding> bindings,
                                Map<String, WorkerDefinition> workers, PythonSyntaxTree tree) {
        TSNode call = statementCall(statement);
        if (call == null) {
            return List.of();
        }

        List<TSNode> chain = new ArrayList<>();
        TSNode current = call;
        while (SyntaxNodes.is(current, SyntaxNodes.CALL)) {
            TSNode callee = SyntaxNodes.unwrap(SyntaxNodes.field(current, "function"));
            if (!SyntaxNodes.is(callee, SyntaxNodes.ATTRIBUTE)) {
                break;
            }
            chain.add(current);
            current = SyntaxNodes.unwrap(SyntaxNodes.field(callee, "object"));
        }
        if (chain.isEmpty() || tree.name(current) == null) {
            return List.of();
        }
        Collections.reverse(chain);

        List<WorkerEdge> edges = new ArrayList<>();
        String last = tree.name(current);
        for (TSNode link : chain) {
            String method = tree.attributeName(SyntaxNodes.unwrap(SyntaxNodes.field(link, "function")));
            List<TSNode> args = SyntaxNodes.positionalArguments(link);
            if (method.equals(SET_DEPENDENCY) && args.size() == 2
                    && tree.name(args.get(0)) != null && tree.name(args.get(1)) != null) {
                edge(tree.name(args.get(0)), tree.name(args.get(1)), bindings, workers).ifPresent(edges::add);
                last = tree.name(args.get(1));
            } else if (method.equals(NEXT) && args.size() == 1 && tree.name(args.get(0)) != null && last != null) {
                edge(last, tree.name(args.get(0)), bindings, workers).ifPresent(edges::add);
                last = tree.name(args.get(0));
            } else {
                last = null;
            }
        }
        return edges;
    }

    private static Optional<WorkerEdge> edge(String sourceVar, String targetVar, Map<String, WorkerBinding> bindings,
                                             Map<String, WorkerDefinition> workers) {
        WorkerBinding source = bindings.get(sourceVar);
        WorkerBinding target = bindings.get(targetVar);
        if (source == null || target == null) {
            return Optional.empty();
        }
        WorkerDefinition targetWorker = workers.get(target.className());
        return Optional.of(WorkerEdge.builder()
                .source(source.className())
                .target(target.className())
                .targetInputType(targetWorker == null ? null : targetWorker.firstInputType())
                .build());
    }

    /** {@code graph.set_entry(w, ...)}: the task type is the worker's inferred input type. */
    List<EntryEdge> setEntryEdges(TSNode statement, Map<String, WorkerBinding> bindings,
                                  Map<String, WorkerDefinition> workers, PythonSyntaxTree tree) {
        TSNode call = graphCall(statement, SET_ENTRY, tree);
        if (call == null) {
            return List.of();
        }
        List<EntryEdge> entries = new ArrayList<>();
        for (TSNode argument : SyntaxNodes.positionalArguments(call)) {
            String variable = tree.name(argument);
            if (variable == null || !bindings.containsKey(variable)) {
                continue;
            }
            String className = bindings.get(variable).className();
            WorkerDefinition worker = workers.get(className);
            if (worker != null && worker.firstInputType() != null) {
                entries.add(new EntryEdge(worker.firstInputType(), className));
            }
        }
        return entries;
    }

    /**
     * {@code graph.run(initial_tasks=[(w, T(...)), ...])}, with the list given inline or
     * through a variable assigned (and possibly appended to) inside the builder.
     */
    List<EntryEdge> runEntryEdges(TSNode statement, Map<String, WorkerBinding> bindings, TSNode builder,
                                  PythonSyntaxTree tree) {
        TSNode call = graphCall(statement, RUN, tree);
        if (call == null) {
            return List.of();
        }
        Optional<TSNode> initialTasks = tree.keyword(call, INITIAL_TASKS);
        if (initialTasks.isEmpty()) {
            return List.of();
        }

        List<TSNode> elements = new ArrayList<>();
        String variable = tree.name(initialTasks.get());
        if (SyntaxNodes.is(initialTasks.get(), SyntaxNodes.LIST)) {
            elements.addAll(SyntaxNodes.elements(initialTasks.get()));
        } else if (variable != null) {
            Optional<TSNode> assigned = lastListAssignment(variable, builder, tree);
            if (assigned.isEmpty()) {
                log.debug("initial_tasks variable '{}' does not resolve to a list literal", variable);
                return List.of();
            }
            elements.addAll(SyntaxNodes.elements(assigned.get()));
            elements.addAll(appendedElements(variable, builder, tree));
        } else {
            return List.of();
        }

        List<EntryEdge> entries = new ArrayList<>();
        for (TSNode element : elements) {
            if (!SyntaxNodes.is(element, SyntaxNodes.TUPLE)) {
                continue;
            }
            List<TSNode> pair = SyntaxNodes.elements(element);
            if (pair.size() != 2 || tree.name(pair.get(0)) == null) {
                continue;
            }
            String taskClass = taskConstructorName(pair.get(1), tree);
            WorkerBinding binding = bindings.get(tree.name(pair.get(0)));
            if (taskClass != null && binding != null) {
                entries.add(new EntryEdge(taskClass, binding.className()));
            }
        }
        return entries;
    }

    /** {@code T(...)} or {@code T.model_validate(...)}. */
    private static String taskConstructorName(TSNode expression, PythonSyntaxTree tree) {
        if (!SyntaxNodes.is(expression, SyntaxNodes.CALL)) {
            return null;
        }
        TSNode callee = SyntaxNodes.unwrap(SyntaxNodes.field(expression, "function"));
        if (SyntaxNodes.is(callee, SyntaxNodes.IDENTIFIER)) {
            return tree.text(callee);
        }
        if (SyntaxNodes.is(callee, SyntaxNodes.ATTRIBUTE) && "model_validate".equals(tree.attributeName(callee))) {
            return tree.name(SyntaxNodes.field(callee, "object"));
        }
        return null;
    }

    private static Optional<TSNode> lastListAssignment(String variable, TSNode builder, PythonSyntaxTree tree) {
        TSNode assigned = null;
        for (TSNode assignment : SyntaxNodes.findAllDescendants(builder, SyntaxNodes.ASSIGNMENT)) {
            if (variable.equals(tree.name(SyntaxNodes.singleTarget(assignment)))) {
                assigned = SyntaxNodes.assignedValue(assignment);
            }
        }
        return SyntaxNodes.is(assigned, SyntaxNodes.LIST) ? Optional.of(assigned) : Optional.empty();
    }

    private static List<TSNode> appendedElements(String variable, TSNode builder, PythonSyntaxTree tree) {
        List<TSNode> appended = new ArrayList<>();
        for (TSNode call : SyntaxNodes.findAllDescendants(builder, SyntaxNodes.CALL)) {
            TSNode callee = SyntaxNodes.unwrap(SyntaxNodes.field(call, "function"));
            List<TSNode> arguments = SyntaxNodes.positionalArguments(call);
            if (SyntaxNodes.is(callee, SyntaxNodes.ATTRIBUTE)
                    && "append".equals(tree.attributeName(callee))
                    && variable.equals(tree.name(SyntaxNodes.field(callee, "object")))
                    && arguments.size() == 1) {
                appended.add(arguments.get(0));
            }
        }
        return appended;
    }

    /**
     * Allowed {@code from M import A [as B]} imports, then the task types of factories in use
     * that nothing else declares.
     */
    public List<ImportedTaskRef> importedTasks(PythonSyntaxTree tree, List<WorkerDefinition> workers,
                                               Set<String> localTasks) {
        List<ImportedTaskRef> refs = new ArrayList<>();
        Set<String> declared = new LinkedHashSet<>(localTasks);
        for (TSNode statement : SyntaxNodes.statements(tree.root())) {
            TSNode moduleName = SyntaxNodes.field(statement, "module_name");
            if (!SyntaxNodes.is(statement, SyntaxNodes.IMPORT_FROM_STATEMENT)
                    || !SyntaxNodes.is(moduleName, SyntaxNodes.DOTTED_NAME)) {
                continue;
            }
            String module = tree.text(moduleName);
            for (TSNode imported : SyntaxNodes.namedChildren(statement)) {
                if (imported.getStartByte() == moduleName.getStartByte()) {
                    continue;
                }
                String name = importedName(imported, tree);
                if (name != null && vocabulary.isAllowedTaskImport(module, name)) {
                    String bound = boundName(imported, name, tree);
                    refs.add(new ImportedTaskRef(module, bound, false));
                    declared.add(bound);
                }
            }
        }

        for (WorkerDefinition worker : workers) {
            if (worker.getFactoryFunction() == null) {
                continue;
            }
            Optional<FactorySpec> factory = vocabulary.factory(worker.getFactoryFunction());
            if (factory.isEmpty()) {
                continue;
            }
            List<String> taskTypes = new ArrayList<>(factory.get().inputTypes());
            taskTypes.addAll(factory.get().outputTypes());
            for (String taskType : taskTypes) {
                if (declared.add(taskType)) {
                    refs.add(new ImportedTaskRef(factory.get().taskModule(), taskType, true));
                }
            }
        }
        return refs;
    }

    /** Module-level imports that are allowed task classes, by bound name. */
    public Set<String> importedTaskNames(PythonSyntaxTree tree) {
        return importedTasks(tree, List.of(), Set.of()).stream()
                .map(ImportedTaskRef::getClassName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String importedName(TSNode imported, PythonSyntaxTree tree) {
        if (SyntaxNodes.is(imported, SyntaxNodes.DOTTED_NAME)) {
            return tree.text(imported);
        }
        if (SyntaxNodes.is(imported, SyntaxNodes.ALIASED_IMPORT)) {
            TSNode name = SyntaxNodes.field(imported, "name");
            return name == null ? null : tree.text(name);
        }
        return null;
    }

    /** Name an import binds in the importing scope. */
    private static String boundName(TSNode imported, String name, PythonSyntaxTree tree) {
        TSNode alias = SyntaxNodes.field(imported, "alias");
        if (alias != null) {
            return tree.text(alias);
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    /** Statements of a body, with {@code try} bodies and their else/finally blocks inlined. */
    static List<TSNode> flatten(List<TSNode> body) {
        List<TSNode> statements = new ArrayList<>();
        for (TSNode statement : body) {
            if (SyntaxNodes.is(statement, SyntaxNodes.TRY_STATEMENT)) {
                statements.addAll(flatten(SyntaxNodes.body(statement)));
                for (TSNode clause : SyntaxNodes.namedChildren(statement)) {
                    if (SyntaxNodes.is(clause, SyntaxNodes.ELSE_CLAUSE) || SyntaxNodes.is(clause, SyntaxNodes.FINALLY_CLAUSE)) {
                        statements.addAll(flatten(SyntaxNodes.body(clause)));
                    }
                }
            } else {
                statements.add(statement);
            }
        }
        return statements;
    }

    private static TSNode statementCall(TSNode statement) {
        TSNode expression = SyntaxNodes.expression(statement);
        if (SyntaxNodes.is(expression, SyntaxNodes.CALL)) {
            return expression;
        }
        TSNode value = SyntaxNodes.assignedValue(SyntaxNodes.assignment(statement));
        return SyntaxNodes.is(value, SyntaxNodes.CALL) ? value : null;
    }

    private static TSNode graphCall(TSNode statement, String method, PythonSyntaxTree tree) {
        TSNode call = SyntaxNodes.expression(statement);
        if (!SyntaxNodes.is(call, SyntaxNodes.CALL)) {
            return null;
        }
        TSNode callee = SyntaxNodes.unwrap(SyntaxNodes.field(call, "function"));
        if (SyntaxNodes.is(callee, SyntaxNodes.ATTRIBUTE)
                && method.equals(tree.attributeName(callee))
                && FrameworkVocabulary.GRAPH_RECEIVERS.contains(tree.name(SyntaxNodes.field(callee, "object")))) {
            return call;
        }
        return null;
    }

    private static List<EntryEdge> dedupe(List<EntryEdge> entries) {
        Map<List<String>, EntryEdge> unique = new LinkedHashMap<>();
        for (EntryEdge entry : entries) {
            unique.putIfAbsent(List.of(entry.getSourceTask(), entry.getTargetWorker()), entry);
        }
        return new ArrayList<>(unique.values());
    }
}

package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import com.purchasingpower.plangraph.parser.PythonSyntaxTree;
import com.purchasingpower.plangraph.parser.SyntaxNodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which module-level classes are Tasks and which are Workers.
 *
 * <p>Ancestry is followed only through classes declared in the same module; imported bases
 * are opaque names. A class with {@code Task} among its ancestors is a task. A class with any
 * worker base class among its ancestors is a worker, and its variant is the first
 * {@link WorkerVariant} (declaration order) whose base class appears.
 */
@Slf4j
@Component
public class ClassClassifier {

    public ClassInventory classify(PythonSyntaxTree tree) {
        Map<String, TSNode> classes = new LinkedHashMap<>();
        for (TSNode statement : SyntaxNodes.statements(tree.root())) {
            if (SyntaxNodes.isClass(statement)) {
                TSNode classDef = SyntaxNodes.definition(statement);
                classes.put(tree.definitionName(classDef), classDef);
            }
        }

        Map<String, TSNode> tasks = new LinkedHashMap<>();
        Map<String, TSNode> workers = new LinkedHashMap<>();
        Map<String, WorkerVariant> variants = new LinkedHashMap<>();

        for (Map.Entry<String, TSNode> entry : classes.entrySet()) {
            String name = entry.getKey();
            Set<String> ancestors = ancestorNames(name, classes, tree);
            if (ancestors.contains(FrameworkVocabulary.TASK_BASE_CLASS)) {
                tasks.put(name, entry.getValue());
                log.debug("Class {} classified as task", name);
                continue;
            }
            Optional<WorkerVariant> variant = variantOf(ancestors);
            if (variant.isPresent()) {
                workers.put(name, entry.getValue());
                variants.put(name, variant.get());
                log.debug("Class {} classified as {}", name, variant.get().getTag());
            }
        }

        return new ClassInventory(
                Collections.unmodifiableMap(tasks),
                Collections.unmodifiableMap(workers),
                Collections.unmodifiableMap(variants));
    }

    /**
     * Transitive base-class names of a class. Cycles through local classes terminate.
     */
    Set<String> ancestorNames(String className, Map<String, TSNode> localClasses, PythonSyntaxTree tree) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(localClasses.get(className));
        Set<String> expanded = new LinkedHashSet<>();
        expanded.add(className);

        while (!pending.isEmpty()) {
            TSNode current = pending.pop();
            for (TSNode base : SyntaxNodes.positionalArguments(current)) {
                String baseName = baseName(base, tree);
                if (baseName == null) {
                    continue;
                }
                seen.add(baseName);
                TSNode local = localClasses.get(baseName);
                if (local != null && expanded.add(baseName)) {
                    pending.push(local);
                }
            }
        }
        return seen;
    }

    static Optional<WorkerVariant> variantOf(Set<String> ancestors) {
        for (WorkerVariant variant : WorkerVariant.values()) {
            if (ancestors.contains(variant.getBaseClass())) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    private static String baseName(TSNode base, PythonSyntaxTree tree) {
        if (SyntaxNodes.is(base, SyntaxNodes.IDENTIFIER)) {
            return tree.text(base);
        }
        if (SyntaxNodes.is(base, SyntaxNodes.ATTRIBUTE)) {
            return tree.attributeName(base);
        }
        if (SyntaxNodes.is(base, SyntaxNodes.SUBSCRIPT)) {
            // Generic[...] style bases: the subscripted class is the ancestor
            return baseName(SyntaxNodes.unwrap(SyntaxNodes.field(base, "value")), tree);
        }
        return null;
    }
}

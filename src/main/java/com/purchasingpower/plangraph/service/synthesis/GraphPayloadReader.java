package com.purchasingpower.plangraph.service.synthesis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.purchasingpower.plangraph.exception.MultipleInputTypesException;
import com.purchasingpower.plangraph.exception.PipelineTransformException;
import com.purchasingpower.plangraph.model.ir.FieldDefinition;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import com.purchasingpower.plangraph.model.payload.GraphEdgePayload;
import com.purchasingpower.plangraph.model.payload.GraphNodePayload;
import com.purchasingpower.plangraph.model.payload.GraphPayload;
import com.purchasingpower.plangraph.util.IdentifierValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an editor payload into typed definitions and resolves its edges.
 *
 * <p>Node data is copied into new objects, so the caller's payload is never modified.
 * Invalid names and non-join workers with several input types are rejected; unknown node
 * types and unresolvable edges are skipped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphPayloadReader {

    private final ObjectMapper objectMapper;

    private enum NodeKind { TASK, TASK_IMPORT, WORKER }

    private record NodeRef(NodeKind kind, String className) {
    }

    public SynthesisPlan read(GraphPayload payload, List<String> warnings) {
        if (payload == null) {
            throw new PipelineTransformException("Payload is empty");
        }

        List<TaskDefinition> tasks = new ArrayList<>();
        List<ImportedTaskRef> imports = new ArrayList<>();
        List<WorkerDefinition> workers = new ArrayList<>();
        Map<String, NodeRef> byId = new HashMap<>();
        Map<String, NodeRef> byClassName = new HashMap<>();

        for (GraphNodePayload node : nullSafe(payload.getNodes())) {
            NodeRef ref;
            if (node.isTask()) {
                TaskDefinition task = convert(node, TaskDefinition.class);
                validateTask(task);
                tasks.add(task);
                ref = new NodeRef(NodeKind.TASK, task.getClassName());
            } else if (node.isTaskImport()) {
                ImportedTaskRef imported = convert(node, ImportedTaskRef.class);
                IdentifierValidator.requireValid(imported.getClassName(), "imported task", imported.getClassName());
                if (Strings.isNullOrEmpty(imported.getModulePath())) {
                    warnings.add("Imported task " + imported.getClassName() + " has no module path; skipped");
                    continue;
                }
                imports.add(imported);
                ref = new NodeRef(NodeKind.TASK_IMPORT, imported.getClassName());
            } else if (node.workerVariant().isPresent()) {
                WorkerDefinition worker = convert(node, WorkerDefinition.class);
                worker.setVariantKind(node.workerVariant().get());
                validateWorker(worker, warnings);
                workers.add(worker);
                ref = new NodeRef(NodeKind.WORKER, worker.getClassName());
            } else {
                warnings.add("Node " + node.getId() + " has unknown type '" + node.getType() + "'; skipped");
                continue;
            }
            if (byClassName.containsKey(ref.className())) {
                throw new PipelineTransformException("Duplicate class name: " + ref.className(), ref.className());
            }
            byClassName.put(ref.className(), ref);
            if (node.getId() != null) {
                byId.put(node.getId(), ref);
            }
        }

        List<WorkerEdge> dependencies = new ArrayList<>();
        Set<String> entryWorkers = new LinkedHashSet<>();
        Set<List<String>> seenDependencies = new LinkedHashSet<>();
        for (GraphEdgePayload edge : nullSafe(payload.getEdges())) {
            NodeRef source = resolve(edge.getSource(), byId, byClassName);
            NodeRef target = resolve(edge.getTarget(), byId, byClassName);
            if (source == null || target == null || target.kind() != NodeKind.WORKER) {
                warnings.add("Edge " + edge.getSource() + " -> " + edge.getTarget()
                        + " does not connect known nodes; skipped");
                continue;
            }
            if (source.kind() == NodeKind.WORKER) {
                if (seenDependencies.add(List.of(source.className(), target.className()))) {
                    dependencies.add(WorkerEdge.builder()
                            .source(source.className())
                            .target(target.className())
                            .build());
                }
            } else {
                entryWorkers.add(target.className());
            }
        }

        for (WorkerDefinition worker : workers) {
            if (worker.isEntryPoint()) {
                entryWorkers.add(worker.getClassName());
            }
        }

        log.debug("Payload: {} task(s), {} import(s), {} worker(s), {} dependency edge(s), {} entry worker(s)",
                tasks.size(), imports.size(), workers.size(), dependencies.size(), entryWorkers.size());
        return new SynthesisPlan(tasks, imports, workers, dependencies, entryWorkers);
    }

    private <T> T convert(GraphNodePayload node, Class<T> type) {
        JsonNode data = node.getData();
        if (data == null || data.isNull() || !data.hasNonNull("className")) {
            throw new PipelineTransformException("Node " + node.getId() + " has no className", node.getId());
        }
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PipelineTransformException(
                    "Node " + node.getId() + " has malformed data: " + e.getMessage(),
                    data.path("className").asText(), e);
        }
    }

    private static void validateTask(TaskDefinition task) {
        IdentifierValidator.requireValid(task.getClassName(), "class", task.getClassName());
        for (FieldDefinition field : nullSafe(task.getFields())) {
            IdentifierValidator.requireValid(field.getName(), "field", task.getClassName());
        }
    }

    private static void validateWorker(WorkerDefinition worker, List<String> warnings) {
        IdentifierValidator.requireValid(worker.getClassName(), "class", worker.getClassName());
        if (worker.getLlmConfigVar() != null) {
            IdentifierValidator.requireValid(worker.getLlmConfigVar(), "llm variable", worker.getClassName());
        }
        List<String> inputTypes = worker.getInputTypes();
        if (inputTypes != null && inputTypes.size() > 1) {
            if (!worker.getVariantKind().isJoin()) {
                throw new MultipleInputTypesException(worker.getClassName(), inputTypes);
            }
            warnings.add("Join worker " + worker.getClassName() + " declares input types " + inputTypes
                    + "; using " + inputTypes.get(0));
            worker.setInputTypes(new ArrayList<>(List.of(inputTypes.get(0))));
        }
        if (inputTypes != null && inputTypes.isEmpty()) {
            worker.setInputTypes(null);
        }
        if (worker.getVariantKind() == WorkerVariant.SUBGRAPH_WORKER && worker.getFactoryFunction() == null) {
            warnings.add("Sub-graph worker " + worker.getClassName() + " has no factory function; emitted as a plain class");
        }
    }

    private static NodeRef resolve(String endpoint, Map<String, NodeRef> byId, Map<String, NodeRef> byClassName) {
        if (endpoint == null) {
            return null;
        }
        NodeRef ref = byId.get(endpoint);
        return ref != null ? ref : byClassName.get(endpoint);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}

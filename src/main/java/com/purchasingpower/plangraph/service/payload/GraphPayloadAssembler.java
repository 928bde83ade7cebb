package com.purchasingpower.plangraph.service.payload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.plangraph.model.ir.EntryEdge;
import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.PipelineDefinition;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;
import com.purchasingpower.plangraph.model.payload.GraphEdgePayload;
import com.purchasingpower.plangraph.model.payload.GraphNodePayload;
import com.purchasingpower.plangraph.model.payload.GraphPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a definition as the node/edge document the graph editor sends back. Node ids are
 * class names.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphPayloadAssembler {

    private final ObjectMapper objectMapper;

    public GraphPayload toPayload(PipelineDefinition definition) {
        List<GraphNodePayload> nodes = new ArrayList<>();
        for (TaskDefinition task : definition.getTasks()) {
            nodes.add(node(task.getClassName(), GraphNodePayload.TASK, task));
        }
        for (ImportedTaskRef imported : definition.getImportedTasks()) {
            nodes.add(node(imported.getClassName(), GraphNodePayload.TASK_IMPORT, imported));
        }
        for (WorkerDefinition worker : definition.getWorkers()) {
            nodes.add(node(worker.getClassName(), worker.getVariantKind().getTag(), worker));
        }

        List<GraphEdgePayload> edges = new ArrayList<>();
        for (WorkerEdge edge : definition.getEdges()) {
            edges.add(edge(edge.getSource(), edge.getTarget()));
        }
        for (EntryEdge entry : definition.getEntryEdges()) {
            edges.add(edge(entry.getSourceTask(), entry.getTargetWorker()));
        }

        log.debug("Assembled payload with {} node(s) and {} edge(s)", nodes.size(), edges.size());
        return GraphPayload.builder().nodes(nodes).edges(edges).build();
    }

    private GraphNodePayload node(String id, String type, Object data) {
        return GraphNodePayload.builder()
                .id(id)
                .type(type)
                .data(objectMapper.valueToTree(data))
                .build();
    }

    private static GraphEdgePayload edge(String source, String target) {
        return GraphEdgePayload.builder()
                .id(source + "->" + target)
                .source(source)
                .target(target)
                .build();
    }
}

package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.EntryEdge;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;

import org.treesitter.TSNode;

import java.util.List;
import java.util.Map;

/**
 * Wiring recovered from the graph builder function.
 *
 * @param builder        the graph builder's {@code function_definition}, null when the module has none
 * @param bindings       worker bindings by variable name, in assignment order
 * @param factoryWorkers workers synthesized from factory calls
 */
public record PipelineTopology(TSNode builder,
                               Map<String, WorkerBinding> bindings,
                               List<WorkerDefinition> factoryWorkers,
                               List<WorkerEdge> edges,
                               List<EntryEdge> entryEdges) {

    public static PipelineTopology empty() {
        return new PipelineTopology(null, Map.of(), List.of(), List.of(), List.of());
    }

    public boolean hasBuilder() {
        return builder != null;
    }
}

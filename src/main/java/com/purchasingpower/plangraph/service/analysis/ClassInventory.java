package com.purchasingpower.plangraph.service.analysis;

import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import org.treesitter.TSNode;

import java.util.Map;

/**
 * Module-level {@code class_definition} nodes split into tasks and workers, in source order.
 */
public record ClassInventory(Map<String, TSNode> tasks,
                             Map<String, TSNode> workers,
                             Map<String, WorkerVariant> variants) {

    public boolean isTask(String name) {
        return tasks.containsKey(name);
    }

    public boolean isWorker(String name) {
        return workers.containsKey(name);
    }

    public WorkerVariant variantOf(String workerName) {
        return variants.get(workerName);
    }
}

package com.purchasingpower.plangraph.service.synthesis;

import com.purchasingpower.plangraph.model.ir.ImportedTaskRef;
import com.purchasingpower.plangraph.model.ir.TaskDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerDefinition;
import com.purchasingpower.plangraph.model.ir.WorkerEdge;

import java.util.List;
import java.util.Set;

/**
 * A validated payload, ready to be written out.
 *
 * @param dependencies  worker to worker edges, by class name
 * @param entryWorkers  class names of workers fed by a task to worker edge
 */
public record SynthesisPlan(List<TaskDefinition> tasks,
                            List<ImportedTaskRef> importedTasks,
                            List<WorkerDefinition> workers,
                            List<WorkerEdge> dependencies,
                            Set<String> entryWorkers) {
}

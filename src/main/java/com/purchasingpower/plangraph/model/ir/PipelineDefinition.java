package com.purchasingpower.plangraph.model.ir;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Intermediate representation of one pipeline source file.
 *
 * <p>Built fresh for every analysis; holds no state shared between calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineDefinition {

    @Builder.Default
    private List<TaskDefinition> tasks = new ArrayList<>();

    @Builder.Default
    private List<WorkerDefinition> workers = new ArrayList<>();

    @Builder.Default
    private List<WorkerEdge> edges = new ArrayList<>();

    @Builder.Default
    private List<EntryEdge> entryEdges = new ArrayList<>();

    @JsonAlias("imported_tasks")
    @Builder.Default
    private List<ImportedTaskRef> importedTasks = new ArrayList<>();

    public static PipelineDefinition empty() {
        return PipelineDefinition.builder().build();
    }

    public Optional<WorkerDefinition> findWorker(String className) {
        return workers.stream().filter(w -> w.getClassName().equals(className)).findFirst();
    }

    public Optional<TaskDefinition> findTask(String className) {
        return tasks.stream().filter(t -> t.getClassName().equals(className)).findFirst();
    }
}

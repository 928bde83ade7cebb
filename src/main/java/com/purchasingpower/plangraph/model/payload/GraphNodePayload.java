package com.purchasingpower.plangraph.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.plangraph.model.ir.WorkerVariant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * One editor node. {@code data} holds a task, imported-task or worker definition in its JSON
 * form, depending on {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphNodePayload {

    public static final String TASK = "task";
    public static final String TASK_IMPORT = "taskimport";
    public static final String TASK_IMPORT_ALIAS = "task-import";

    private String id;

    private String type;

    private JsonNode data;

    @JsonIgnore
    public boolean isTask() {
        return TASK.equals(type);
    }

    @JsonIgnore
    public boolean isTaskImport() {
        return TASK_IMPORT.equals(type) || TASK_IMPORT_ALIAS.equals(type);
    }

    @JsonIgnore
    public Optional<WorkerVariant> workerVariant() {
        return type == null ? Optional.empty() : WorkerVariant.findByTag(type);
    }
}

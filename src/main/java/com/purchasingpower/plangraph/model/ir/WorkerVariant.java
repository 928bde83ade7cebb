package com.purchasingpower.plangraph.model.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Worker variant kinds. Declaration order is the classification priority: a class whose
 * ancestors contain several framework base classes takes the first variant listed here.
 */
@Getter
public enum WorkerVariant {

    CACHED_LLM_TASK_WORKER("cachedllmtaskworker", "CachedLLMTaskWorker"),
    CACHED_TASK_WORKER("cachedtaskworker", "CachedTaskWorker"),
    LLM_TASK_WORKER("llmtaskworker", "LLMTaskWorker"),
    JOINED_TASK_WORKER("joinedtaskworker", "JoinedTaskWorker"),
    SUBGRAPH_WORKER("subgraphworker", "SubGraphWorker"),
    TASK_WORKER("taskworker", "TaskWorker"),
    CHAT_TASK_WORKER("chattaskworker", "ChatTaskWorker");

    @JsonValue
    private final String tag;
    private final String baseClass;

    WorkerVariant(String tag, String baseClass) {
        this.tag = tag;
        this.baseClass = baseClass;
    }

    @JsonCreator
    public static WorkerVariant fromTag(String tag) {
        return findByTag(tag).orElseThrow(() -> new IllegalArgumentException("Unknown worker type: " + tag));
    }

    public static Optional<WorkerVariant> findByTag(String tag) {
        return Arrays.stream(values()).filter(v -> v.tag.equals(tag)).findFirst();
    }

    public static Optional<WorkerVariant> findByBaseClass(String baseClass) {
        return Arrays.stream(values()).filter(v -> v.baseClass.equals(baseClass)).findFirst();
    }

    /** Variants whose {@code llm_input_type} classvar overrides the consume_work annotation. */
    public boolean usesLlmInputType() {
        return this == LLM_TASK_WORKER || this == CACHED_LLM_TASK_WORKER;
    }

    /** Variants constructed with an {@code llm=} argument. */
    public boolean requiresLlm() {
        return usesLlmInputType() || this == CHAT_TASK_WORKER;
    }

    public boolean isJoin() {
        return this == JOINED_TASK_WORKER;
    }
}

package com.purchasingpower.plangraph.model.result;

import lombok.Builder;
import lombok.Value;

/**
 * What a run of generated source reported through its stdout markers.
 *
 * <p>{@code markerFound} is false when no complete marker block was printed and the outcome
 * was derived from the exit code alone.
 */
@Value
@Builder
public class ExecutionOutcome {

    boolean success;

    String message;

    String nodeName;

    String fullTraceback;

    boolean markerFound;

    int exitCode;
}

package com.purchasingpower.plangraph.model.result;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of comparing two pipeline definitions. {@code differences} is empty iff equivalent.
 */
@Value
@Builder
public class EquivalenceReport {

    boolean equivalent;

    @Builder.Default
    List<String> differences = List.of();

    public static EquivalenceReport of(List<String> differences) {
        return EquivalenceReport.builder()
                .equivalent(differences.isEmpty())
                .differences(List.copyOf(differences))
                .build();
    }

    public String getSummary() {
        if (equivalent) {
            return "Definitions are equivalent";
        }
        return String.format("Definitions differ in %d place(s):%n  - %s",
                differences.size(), String.join(String.format("%n  - "), differences));
    }
}

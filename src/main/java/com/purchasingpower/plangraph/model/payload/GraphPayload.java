package com.purchasingpower.plangraph.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Node/edge document exchanged with the graph editor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphPayload {

    @Builder.Default
    private List<GraphNodePayload> nodes = new ArrayList<>();

    @Builder.Default
    private List<GraphEdgePayload> edges = new ArrayList<>();
}

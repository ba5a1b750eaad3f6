package com.dataflowscope.core.model;

import java.util.List;

/**
 * Raw node and edge sets produced by the graph assembler.
 *
 * @param nodes nodes in id order
 * @param edges edges in emission order
 */
public record GraphBuildResult(List<GraphNode> nodes, List<GraphEdge> edges) {

    /**
     * Compact constructor with defaults.
     */
    public GraphBuildResult {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static GraphBuildResult empty() {
        return new GraphBuildResult(List.of(), List.of());
    }
}

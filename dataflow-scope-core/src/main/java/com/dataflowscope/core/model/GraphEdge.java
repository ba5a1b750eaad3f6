package com.dataflowscope.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A directed dataflow edge between two nodes.
 *
 * @param id edge id, unique within a graph
 * @param source producing node
 * @param target consuming node
 * @param semanticTags semantic tags such as {@code network} or {@code Stream}
 */
public record GraphEdge(
    String id,
    NodeId source,
    NodeId target,
    List<String> semanticTags
) {
    /**
     * Compact constructor with defaults.
     */
    public GraphEdge {
        semanticTags = semanticTags == null ? List.of() : List.copyOf(semanticTags);
    }

    public static GraphEdge between(String id, NodeId source, NodeId target) {
        return new GraphEdge(id, source, target, List.of());
    }

    /**
     * Returns a copy with the given tags appended after the existing ones.
     *
     * @param tags tags to append
     * @return updated edge
     */
    public GraphEdge withAddedTags(Collection<String> tags) {
        List<String> merged = new ArrayList<>(semanticTags);
        merged.addAll(tags);
        return new GraphEdge(id, source, target, merged);
    }

    public GraphEdge withTags(List<String> tags) {
        return new GraphEdge(id, source, target, tags);
    }
}

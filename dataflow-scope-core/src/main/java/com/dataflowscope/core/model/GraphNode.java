package com.dataflowscope.core.model;

import java.util.Objects;

/**
 * A node of the dataflow graph: one operator call site.
 *
 * <p>{@code nodeType} and {@code shortLabel} are not enforced here so that graphs read back
 * from JSON can be reported on by the graph validator instead of failing to load.
 *
 * @param id dense node id
 * @param nodeType operator category
 * @param shortLabel operator name
 * @param fullLabel call-site text, e.g. {@code map(|x| x + 1)}
 * @param label display label, initially the short label
 * @param data location and scoping payload
 */
public record GraphNode(
    NodeId id,
    NodeType nodeType,
    String shortLabel,
    String fullLabel,
    String label,
    NodeData data
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        if (label == null) {
            label = shortLabel;
        }
        if (fullLabel == null) {
            fullLabel = shortLabel;
        }
        if (data == null) {
            data = NodeData.at(null);
        }
    }

    public GraphNode withData(NodeData newData) {
        return new GraphNode(id, nodeType, shortLabel, fullLabel, label, newData);
    }

    public GraphNode withFullLabel(String newFullLabel) {
        return new GraphNode(id, nodeType, shortLabel, newFullLabel, label, data);
    }
}

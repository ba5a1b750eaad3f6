package com.dataflowscope.core.model;

import java.util.List;
import java.util.Map;

/**
 * Final output of an extraction pass.
 *
 * <p>Serialises to the JSON document consumed by the hierarchical graph viewer.
 *
 * @param nodes graph nodes
 * @param edges graph edges with sorted semantic tags
 * @param hierarchyChoices location and code hierarchies
 * @param nodeAssignments per hierarchy id: node id to container id
 * @param selectedHierarchy hierarchy shown first
 * @param edgeStyleConfig edge styling metadata
 * @param nodeTypeConfig node type palette
 * @param legend legend metadata
 */
public record DataflowGraph(
    List<GraphNode> nodes,
    List<GraphEdge> edges,
    List<Hierarchy> hierarchyChoices,
    Map<String, Map<String, String>> nodeAssignments,
    String selectedHierarchy,
    EdgeStyleConfig edgeStyleConfig,
    NodeTypeConfig nodeTypeConfig,
    Legend legend
) {
    /**
     * Compact constructor with defaults.
     */
    public DataflowGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        hierarchyChoices = hierarchyChoices == null ? List.of() : List.copyOf(hierarchyChoices);
        nodeAssignments = nodeAssignments == null ? Map.of() : nodeAssignments;
    }
}

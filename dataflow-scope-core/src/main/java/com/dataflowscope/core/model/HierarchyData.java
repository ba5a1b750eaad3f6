package com.dataflowscope.core.model;

import java.util.List;
import java.util.Map;

/**
 * Both hierarchies of a graph together with their node assignments.
 *
 * @param hierarchyChoices available hierarchies
 * @param nodeAssignments per hierarchy id: node id to container id
 * @param selectedHierarchy hierarchy shown first
 */
public record HierarchyData(
    List<Hierarchy> hierarchyChoices,
    Map<String, Map<String, String>> nodeAssignments,
    String selectedHierarchy
) {
    /**
     * Compact constructor with defaults.
     */
    public HierarchyData {
        hierarchyChoices = hierarchyChoices == null ? List.of() : List.copyOf(hierarchyChoices);
        nodeAssignments = nodeAssignments == null ? Map.of() : nodeAssignments;
    }
}

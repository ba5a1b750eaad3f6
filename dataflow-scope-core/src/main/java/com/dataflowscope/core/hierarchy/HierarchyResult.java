package com.dataflowscope.core.hierarchy;

import com.dataflowscope.core.model.Hierarchy;

import java.util.Map;
import java.util.Objects;

/**
 * One built hierarchy and the container each node is assigned to.
 *
 * @param hierarchy container tree
 * @param assignments node id to container id, in node order
 */
public record HierarchyResult(Hierarchy hierarchy, Map<String, String> assignments) {

    /**
     * Compact constructor with validation.
     */
    public HierarchyResult {
        Objects.requireNonNull(hierarchy, "hierarchy must not be null");
        Objects.requireNonNull(assignments, "assignments must not be null");
    }
}

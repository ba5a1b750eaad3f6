package com.dataflowscope.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named grouping of nodes inside a hierarchy.
 *
 * @param id container id, e.g. {@code loc_3} or {@code code_1}
 * @param name display name
 * @param children nested containers
 */
public record HierarchyContainer(String id, String name, List<HierarchyContainer> children) {

    /**
     * Compact constructor with validation and defaults.
     */
    public HierarchyContainer {
        Objects.requireNonNull(id, "id must not be null");
        children = children == null ? List.of() : List.copyOf(children);
    }
}

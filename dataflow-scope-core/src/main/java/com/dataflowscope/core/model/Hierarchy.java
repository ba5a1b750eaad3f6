package com.dataflowscope.core.model;

import java.util.List;

/**
 * One clustering of the node set, e.g. by runtime location or by source structure.
 *
 * <p>{@code id} and {@code name} are not enforced so that malformed graphs can be validated.
 *
 * @param id hierarchy id ({@code location} or {@code code})
 * @param name display name
 * @param children top-level containers
 */
public record Hierarchy(String id, String name, List<HierarchyContainer> children) {

    /**
     * Compact constructor with defaults.
     */
    public Hierarchy {
        children = children == null ? List.of() : List.copyOf(children);
    }
}

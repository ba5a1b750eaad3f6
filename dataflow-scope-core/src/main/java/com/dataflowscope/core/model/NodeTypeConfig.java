package com.dataflowscope.core.model;

import java.util.List;

/**
 * Node type palette consumed by the renderer.
 *
 * @param defaultType label of the fallback node type
 * @param types styled node types
 */
public record NodeTypeConfig(String defaultType, List<TypeStyle> types) {

    /**
     * Compact constructor with defaults.
     */
    public NodeTypeConfig {
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * Style entry for one node type.
     *
     * @param id node type label
     * @param label display label
     * @param colorIndex palette index
     */
    public record TypeStyle(String id, String label, int colorIndex) {
    }
}

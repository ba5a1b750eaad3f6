package com.dataflowscope.core.model;

import java.util.List;

/**
 * Legend shown next to the rendered graph.
 *
 * @param title legend title
 * @param items legend entries
 */
public record Legend(String title, List<Item> items) {

    /**
     * Compact constructor with defaults.
     */
    public Legend {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * One legend entry.
     *
     * @param type node type label
     * @param label display label
     */
    public record Item(String type, String label) {
    }
}

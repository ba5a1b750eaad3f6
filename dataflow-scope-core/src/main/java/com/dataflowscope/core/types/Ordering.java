package com.dataflowscope.core.types;

/**
 * Ordering guarantee of a collection.
 */
public enum Ordering {
    /** Elements arrive in a deterministic total order */
    TOTAL_ORDER("TotalOrder"),

    /** No ordering guarantee */
    NO_ORDER("NoOrder");

    private final String tag;

    Ordering(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

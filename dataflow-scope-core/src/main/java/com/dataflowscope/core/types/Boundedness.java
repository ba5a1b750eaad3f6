package com.dataflowscope.core.types;

/**
 * Whether a collection is finite within its scope.
 */
public enum Boundedness {
    /** Finite, e.g. the contents of one tick */
    BOUNDED("Bounded"),

    /** Potentially infinite */
    UNBOUNDED("Unbounded");

    private final String tag;

    Boundedness(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the semantic edge tag for this boundedness.
     *
     * @return tag string
     */
    public String tag() {
        return tag;
    }
}

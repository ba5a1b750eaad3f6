package com.dataflowscope.core.types;

/**
 * Live collection constructors recognised in return types.
 */
public enum CollectionKind {
    STREAM("Stream", "Stream", false),
    KEYED_STREAM("KeyedStream", "Stream", true),
    SINGLETON("Singleton", "Singleton", false),
    KEYED_SINGLETON("KeyedSingleton", "Singleton", true),
    OPTIONAL("Optional", "Optional", false);

    private final String constructor;
    private final String shapeTag;
    private final boolean keyed;

    CollectionKind(String constructor, String shapeTag, boolean keyed) {
        this.constructor = constructor;
        this.shapeTag = shapeTag;
        this.keyed = keyed;
    }

    /**
     * Returns the type constructor name, e.g. {@code KeyedStream}.
     *
     * @return constructor name
     */
    public String constructor() {
        return constructor;
    }

    /**
     * Returns the collection-shape edge tag ({@code Stream}, {@code Singleton} or {@code Optional}).
     *
     * @return shape tag
     */
    public String shapeTag() {
        return shapeTag;
    }

    public boolean keyed() {
        return keyed;
    }

    /**
     * Index of the location parameter: second for plain collections, third for keyed ones.
     *
     * @return zero-based parameter index
     */
    public int locationParameterIndex() {
        return keyed ? 2 : 1;
    }

    /**
     * Resolves a kind from its constructor name.
     *
     * @param name constructor name
     * @return matching kind, or null if unknown
     */
    static CollectionKind fromConstructor(String name) {
        for (CollectionKind kind : values()) {
            if (kind.constructor.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}

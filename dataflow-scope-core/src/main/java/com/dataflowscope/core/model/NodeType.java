package com.dataflowscope.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operator categories used to classify graph nodes.
 */
public enum NodeType {
    /** Produces data (e.g. {@code source_iter}) */
    SOURCE("Source"),

    /** Consumes data (e.g. {@code for_each}) */
    SINK("Sink"),

    /** Element-wise transformation, the default category */
    TRANSFORM("Transform"),

    /** Combines two inputs (e.g. {@code join}) */
    JOIN("Join"),

    /** Moves data between locations */
    NETWORK("Network"),

    /** Folds many elements into fewer (e.g. {@code reduce}) */
    AGGREGATION("Aggregation"),

    /** Fans out or retains data (e.g. {@code tee}, {@code persist}) */
    TEE("Tee");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a node type from its label, ignoring case.
     *
     * @param label label such as {@code "Source"}
     * @return matching node type
     * @throws IllegalArgumentException if no type has that label
     */
    @JsonCreator
    public static NodeType fromLabel(String label) {
        for (NodeType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + label);
    }
}

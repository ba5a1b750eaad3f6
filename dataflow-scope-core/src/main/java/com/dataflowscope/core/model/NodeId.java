package com.dataflowscope.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Dense, zero-based node identity assigned in order of first creation.
 *
 * <p>Serialised as the decimal string of the index.
 *
 * @param index zero-based index
 */
public record NodeId(int index) {

    /**
     * Compact constructor with validation.
     */
    public NodeId {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
    }

    /**
     * Parses a serialised node id.
     *
     * @param value decimal string
     * @return node id
     * @throws IllegalArgumentException if the value is not a non-negative integer
     */
    @JsonCreator
    public static NodeId parse(String value) {
        try {
            return new NodeId(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid node id: " + value, e);
        }
    }

    @JsonValue
    @Override
    public String toString() {
        return Integer.toString(index);
    }
}

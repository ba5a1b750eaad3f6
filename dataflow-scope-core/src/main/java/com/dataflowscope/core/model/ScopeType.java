package com.dataflowscope.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Granularity of an extraction pass.
 */
public enum ScopeType {
    /** Only the functions listed in the scope target */
    FUNCTION,

    /** The whole active file */
    FILE,

    /** Every file of the workspace */
    WORKSPACE;

    /**
     * Returns the lower-case name used in cache keys and JSON.
     *
     * @return key segment
     */
    @JsonValue
    public String keySegment() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a scope type from its name, ignoring case.
     *
     * @param value scope name such as {@code file}
     * @return scope type
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static ScopeType fromKey(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

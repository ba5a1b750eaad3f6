package com.dataflowscope.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Which part of the document an extraction pass should cover.
 *
 * @param type scope granularity
 * @param activeFilePath active file path for workspace scope, or null
 * @param functions function names for {@link ScopeType#FUNCTION} scope
 */
public record ScopeTarget(
    ScopeType type,
    String activeFilePath,
    List<String> functions
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ScopeTarget {
        Objects.requireNonNull(type, "type must not be null");
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static ScopeTarget file() {
        return new ScopeTarget(ScopeType.FILE, null, List.of());
    }

    public static ScopeTarget functions(List<String> names) {
        return new ScopeTarget(ScopeType.FUNCTION, null, names);
    }
}

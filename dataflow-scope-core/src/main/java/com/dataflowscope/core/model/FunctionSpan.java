package com.dataflowscope.core.model;

import java.util.Objects;

/**
 * Line extent of a function definition, inclusive on both ends.
 *
 * @param name function name
 * @param startLine zero-based first line
 * @param endLine zero-based last line
 */
public record FunctionSpan(String name, int startLine, int endLine) {

    /**
     * Compact constructor with validation.
     */
    public FunctionSpan {
        Objects.requireNonNull(name, "name must not be null");
        if (endLine < startLine) {
            throw new IllegalArgumentException("endLine must not precede startLine for function " + name);
        }
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public int length() {
        return endLine - startLine;
    }
}

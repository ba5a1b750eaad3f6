package com.dataflowscope.core.model;

import java.util.Objects;

/**
 * One stage of an operator chain, as reported by the syntactic extractor.
 *
 * <p>Positions are zero-based. {@code tickArgument} is only present for tick-scoping
 * operators such as {@code batch(&tick)} and holds the name of the tick variable passed in.
 *
 * @param name operator (method) name, e.g. {@code map}
 * @param line line of the operator name
 * @param column column of the operator name
 * @param endLine line where the call ends
 * @param endColumn column where the call ends
 * @param tickArgument tick variable argument, or null
 */
public record OperatorCall(
    String name,
    int line,
    int column,
    int endLine,
    int endColumn,
    String tickArgument
) {
    /**
     * Compact constructor with validation.
     */
    public OperatorCall {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Creates a single-line call without tick argument.
     *
     * @param name operator name
     * @param line zero-based line
     * @param column zero-based column
     * @return operator call spanning {@code name} on one line
     */
    public static OperatorCall at(String name, int line, int column) {
        return new OperatorCall(name, line, column, line, column + name.length(), null);
    }

    /**
     * Returns the position of the operator name.
     *
     * @return source position
     */
    public SourcePosition position() {
        return new SourcePosition(line, column);
    }
}

package com.dataflowscope.core.model;

import java.util.Objects;

/**
 * Raw type information reported by the type oracle for one operator position.
 *
 * <p>Either type field may be null when the oracle only partially resolved the call.
 *
 * @param operatorName operator name at the annotated position
 * @param line zero-based line
 * @param column zero-based column
 * @param returnType full return type string, e.g. {@code Stream<T, Process<'a, Leader>, Unbounded>}
 * @param locationType location type string if reported separately
 */
public record TypeAnnotation(
    String operatorName,
    int line,
    int column,
    String returnType,
    String locationType
) {
    /**
     * Compact constructor with validation.
     */
    public TypeAnnotation {
        Objects.requireNonNull(operatorName, "operatorName must not be null");
    }
}

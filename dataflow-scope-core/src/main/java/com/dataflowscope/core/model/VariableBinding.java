package com.dataflowscope.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An operator chain bound to a variable, e.g. {@code let words = lines.flat_map(...).filter(...)}.
 *
 * @param variableName bound variable name
 * @param declarationLine zero-based line of the binding statement
 * @param operators chain stages in source order
 */
public record VariableBinding(
    String variableName,
    int declarationLine,
    List<OperatorCall> operators
) {
    /**
     * Compact constructor with validation.
     */
    public VariableBinding {
        Objects.requireNonNull(variableName, "variableName must not be null");
        operators = operators == null ? List.of() : List.copyOf(operators);
    }
}

package com.dataflowscope.core.model;

import java.util.List;

/**
 * A standalone operator chain that is not bound to any variable.
 *
 * @param operators chain stages in source order
 */
public record OperatorChain(List<OperatorCall> operators) {

    /**
     * Compact constructor with defaults.
     */
    public OperatorChain {
        operators = operators == null ? List.of() : List.copyOf(operators);
    }
}

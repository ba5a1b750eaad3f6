package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.FunctionSpan;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Answers "which function encloses line N" for a document.
 */
@FunctionalInterface
public interface FunctionResolver {

    /** Name used for code outside of any function. */
    String TOP_LEVEL = "(top-level)";

    /**
     * Resolves the enclosing function of a line.
     *
     * @param line zero-based line
     * @return function name, or empty at top level
     */
    Optional<String> enclosingFunction(int line);

    /**
     * Resolves the enclosing function, falling back to {@link #TOP_LEVEL}.
     *
     * @param line zero-based line
     * @return function name or {@code (top-level)}
     */
    default String enclosingFunctionOrTopLevel(int line) {
        return enclosingFunction(line).orElse(TOP_LEVEL);
    }

    /**
     * Creates a resolver over function spans. Nested functions win over their enclosing ones.
     *
     * @param spans function spans of the document
     * @return resolver picking the innermost span containing the line
     */
    static FunctionResolver fromSpans(List<FunctionSpan> spans) {
        List<FunctionSpan> copy = List.copyOf(spans);
        return line -> copy.stream()
            .filter(span -> span.contains(line))
            .min(Comparator.comparingInt(FunctionSpan::length))
            .map(FunctionSpan::name);
    }
}

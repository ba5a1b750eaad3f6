package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.SourcePosition;
import com.dataflowscope.core.model.TypeAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches type oracle annotations back to operator call sites.
 *
 * <p>The oracle and the syntactic extractor may disagree slightly on positions, so an
 * annotation matches the nearest call of the same operator name, with distance
 * {@code |dLine| * 100 + |dColumn|}. Matches at or beyond the tolerance are discarded and
 * the operator proceeds without type information.
 */
public class TypeAnnotationIndex {

    private static final Logger log = LoggerFactory.getLogger(TypeAnnotationIndex.class);

    private static final int LINE_WEIGHT = 100;

    private final Map<String, List<TypeAnnotation>> annotationsByOperator;
    private final int tolerance;

    /**
     * Creates an index.
     *
     * @param annotations type annotations of one document
     * @param tolerance exclusive distance limit
     */
    public TypeAnnotationIndex(List<TypeAnnotation> annotations, int tolerance) {
        this.tolerance = tolerance;
        this.annotationsByOperator = new HashMap<>();
        for (TypeAnnotation annotation : annotations) {
            annotationsByOperator
                .computeIfAbsent(annotation.operatorName(), name -> new ArrayList<>())
                .add(annotation);
        }
    }

    /**
     * Creates an index without annotations, so every lookup misses.
     *
     * @return empty index
     */
    public static TypeAnnotationIndex empty() {
        return new TypeAnnotationIndex(List.of(), 1);
    }

    /**
     * Finds the annotation nearest to a call site. Ties keep the first reported annotation.
     *
     * @param operatorName operator name
     * @param position call-site position
     * @return best annotation within tolerance, or empty
     */
    public Optional<TypeAnnotation> match(String operatorName, SourcePosition position) {
        List<TypeAnnotation> candidates = annotationsByOperator.get(operatorName);
        if (candidates == null) {
            return Optional.empty();
        }

        TypeAnnotation best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (TypeAnnotation candidate : candidates) {
            int distance = distance(candidate, position);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }

        if (best != null && bestDistance < tolerance) {
            return Optional.of(best);
        }
        log.debug("No type annotation for {} at {}:{} (best distance: {})",
            operatorName, position.line(), position.column(), bestDistance);
        return Optional.empty();
    }

    public boolean isEmpty() {
        return annotationsByOperator.isEmpty();
    }

    private static int distance(TypeAnnotation annotation, SourcePosition position) {
        return Math.abs(annotation.line() - position.line()) * LINE_WEIGHT
            + Math.abs(annotation.column() - position.column());
    }
}

package com.dataflowscope.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Input of one extraction pass.
 *
 * @param document analysed document
 * @param scope scope of the pass
 * @param syntax syntactic extractor output
 * @param typeAnnotations type oracle output, possibly empty
 */
public record ExtractionRequest(
    SourceDocument document,
    ScopeTarget scope,
    SyntaxSnapshot syntax,
    List<TypeAnnotation> typeAnnotations
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ExtractionRequest {
        Objects.requireNonNull(document, "document must not be null");
        if (scope == null) {
            scope = ScopeTarget.file();
        }
        if (syntax == null) {
            syntax = SyntaxSnapshot.empty();
        }
        typeAnnotations = typeAnnotations == null ? List.of() : List.copyOf(typeAnnotations);
    }
}

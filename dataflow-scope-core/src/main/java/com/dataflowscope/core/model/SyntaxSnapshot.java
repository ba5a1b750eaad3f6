package com.dataflowscope.core.model;

import java.util.List;

/**
 * Everything the syntactic extractor reports for one document.
 *
 * @param bindings variable-bound chains in source order
 * @param standaloneChains unbound chains in source order
 * @param functions function spans of the document
 */
public record SyntaxSnapshot(
    List<VariableBinding> bindings,
    List<OperatorChain> standaloneChains,
    List<FunctionSpan> functions
) {
    /**
     * Compact constructor with defaults.
     */
    public SyntaxSnapshot {
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
        standaloneChains = standaloneChains == null ? List.of() : List.copyOf(standaloneChains);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public static SyntaxSnapshot empty() {
        return new SyntaxSnapshot(List.of(), List.of(), List.of());
    }
}

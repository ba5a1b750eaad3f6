package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.OperatorCall;
import com.dataflowscope.core.model.SourceDocument;

import java.util.Collection;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects which previously bound variable a chain reads from.
 *
 * <p>The receiver of a chain's first operator is the identifier right before its dot:
 * <pre>{@code
 * reduced.snapshot(&tick)            // receiver: reduced
 * let pairs = words.map(|w| (w, 1))  // receiver: words
 * let counts = pairs                 // receiver on the previous line: pairs
 *     .fold_keyed(...)
 * }</pre>
 * A receiver that is itself a field or method access ({@code self.input.map()}) or a call
 * result ({@code make().map()}) is not a variable reference.
 */
public class VariableReferenceDetector {

    private static final Pattern TRAILING_IDENTIFIER = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)$");

    /**
     * Finds the variable the call's receiver refers to.
     *
     * @param document source document
     * @param firstCall first operator call of a chain
     * @param knownVariables variables with a recorded producer node
     * @return referenced variable, or empty
     */
    public Optional<String> detect(SourceDocument document, OperatorCall firstCall, Collection<String> knownVariables) {
        if (knownVariables.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> line = document.lineAt(firstCall.line());
        if (line.isEmpty()) {
            return Optional.empty();
        }

        String lineText = line.get();
        String prefix = lineText.substring(0, Math.min(Math.max(firstCall.column(), 0), lineText.length())).stripTrailing();
        if (!prefix.endsWith(".")) {
            return Optional.empty();
        }

        String receiver = prefix.substring(0, prefix.length() - 1).stripTrailing();
        if (receiver.isBlank()) {
            // Continuation line: the receiver ends the previous line.
            return document.lineAt(firstCall.line() - 1)
                .flatMap(previous -> receiverVariable(previous.strip(), knownVariables));
        }
        return receiverVariable(receiver, knownVariables);
    }

    private static Optional<String> receiverVariable(String text, Collection<String> knownVariables) {
        Matcher matcher = TRAILING_IDENTIFIER.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String identifier = matcher.group(1);
        String before = text.substring(0, matcher.start()).stripTrailing();
        if (before.endsWith(".") || before.endsWith("::")) {
            return Optional.empty();
        }
        return knownVariables.contains(identifier) ? Optional.of(identifier) : Optional.empty();
    }
}

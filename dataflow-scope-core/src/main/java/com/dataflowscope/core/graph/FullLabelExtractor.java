package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.OperatorCall;
import com.dataflowscope.core.model.SourceDocument;

import java.util.Optional;

/**
 * Renders the call-site text of an operator, e.g. {@code map(|x| x + 1)}.
 *
 * <p>Calls whose argument list spans several lines render as {@code name(...)}. Long
 * single-line calls are cut at the last space, comma or pipe before the length limit and
 * closed with {@code ...)}, so labels never exceed the configured length.
 */
public class FullLabelExtractor {

    private static final String TRUNCATION_SUFFIX = "...)";

    private final int maxLength;

    public FullLabelExtractor(int maxLength) {
        if (maxLength <= TRUNCATION_SUFFIX.length()) {
            throw new IllegalArgumentException("maxLength must exceed " + TRUNCATION_SUFFIX.length() + ": " + maxLength);
        }
        this.maxLength = maxLength;
    }

    /**
     * Extracts the label for a call.
     *
     * @param document source document
     * @param call operator call
     * @return call-site label, or the bare operator name if the text is unavailable
     */
    public String extract(SourceDocument document, OperatorCall call) {
        String name = call.name();
        Optional<String> line = document.lineAt(call.line());
        if (line.isEmpty()) {
            return name;
        }

        String lineText = line.get();
        int operatorStart = call.column();
        int operatorEnd = operatorStart + name.length();
        if (operatorStart < 0 || operatorEnd > lineText.length()
            || !lineText.startsWith(name, operatorStart)) {
            return name;
        }

        int openParen = operatorEnd;
        while (openParen < lineText.length() && Character.isWhitespace(lineText.charAt(openParen))) {
            openParen++;
        }
        if (openParen >= lineText.length() || lineText.charAt(openParen) != '(') {
            return name;
        }

        int depth = 0;
        for (int i = openParen; i < lineText.length(); i++) {
            char c = lineText.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return truncate(lineText.substring(operatorStart, i + 1), name);
                }
            }
        }

        // Argument list continues on following lines; its closing line is not rendered.
        return name + "(...)";
    }

    private String truncate(String fullCall, String name) {
        if (fullCall.length() <= maxLength) {
            return fullCall;
        }
        String truncated = fullCall.substring(0, maxLength - TRUNCATION_SUFFIX.length());
        int cutPoint = Math.max(truncated.lastIndexOf(' '), Math.max(truncated.lastIndexOf(','), truncated.lastIndexOf('|')));
        if (cutPoint > name.length() + 5) {
            return truncated.substring(0, cutPoint) + TRUNCATION_SUFFIX;
        }
        return truncated + TRUNCATION_SUFFIX;
    }
}

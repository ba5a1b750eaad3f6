package com.dataflowscope.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identity and text of the analysed source file.
 *
 * @param uri document URI, used for cache keys
 * @param fileName file path or name, used for the code hierarchy root
 * @param version document version, bumped on every edit
 * @param lines document text split into lines
 */
public record SourceDocument(
    String uri,
    String fileName,
    int version,
    List<String> lines
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public SourceDocument {
        Objects.requireNonNull(uri, "uri must not be null");
        if (fileName == null || fileName.isBlank()) {
            fileName = uri;
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Creates a document from its full text.
     *
     * @param uri document URI
     * @param version document version
     * @param text full text
     * @return document with the text split on line terminators
     */
    public static SourceDocument of(String uri, int version, String text) {
        return new SourceDocument(uri, uri, version, text.lines().toList());
    }

    /**
     * Returns the text of a line.
     *
     * @param line zero-based line number
     * @return line text, or empty when out of range
     */
    public Optional<String> lineAt(int line) {
        if (line < 0 || line >= lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(line));
    }

    /**
     * Returns the last path segment of {@link #fileName()}.
     *
     * @return base name of the file
     */
    public String baseName() {
        String normalized = fileName.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}

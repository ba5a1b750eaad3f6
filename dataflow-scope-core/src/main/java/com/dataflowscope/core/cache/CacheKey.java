package com.dataflowscope.core.cache;

import com.dataflowscope.core.model.ScopeTarget;
import com.dataflowscope.core.model.ScopeType;
import com.dataflowscope.core.model.SourceDocument;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identity of a cached extraction result.
 *
 * <p>Rendered as {@code uri::v<version>::scope[::activeFilePath][::fn=a,b]}, e.g.
 * {@code file:///src/main.rs::v3::file} or {@code file:///src/main.rs::v3::function::fn=helper,main}.
 * Function names are kept sorted and distinct, so the order of a request's function list does
 * not change the key.
 *
 * @param documentUri document URI
 * @param documentVersion document version
 * @param scope scope discriminator, e.g. {@code function}
 * @param activeFilePath active file for narrower scopes, or null
 * @param functions selected functions for function scope, possibly empty
 */
public record CacheKey(String documentUri, int documentVersion, String scope, String activeFilePath,
                       List<String> functions) {

    private static final String SEPARATOR = "::";
    private static final String FUNCTIONS_PREFIX = "fn=";
    private static final String FUNCTION_SEPARATOR = ",";
    private static final Pattern VERSION_SEGMENT = Pattern.compile("^v(\\d+)$");

    /**
     * Compact constructor with validation.
     */
    public CacheKey {
        Objects.requireNonNull(documentUri, "documentUri must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        if (activeFilePath != null && activeFilePath.isEmpty()) {
            activeFilePath = null;
        }
        functions = functions == null
            ? List.of()
            : functions.stream().filter(name -> name != null && !name.isBlank()).distinct().sorted().toList();
    }

    public CacheKey(String documentUri, int documentVersion, String scope, String activeFilePath) {
        this(documentUri, documentVersion, scope, activeFilePath, List.of());
    }

    /**
     * Creates the key of an extraction pass.
     *
     * @param document analysed document
     * @param scope pass scope
     * @return cache key
     */
    public static CacheKey of(SourceDocument document, ScopeTarget scope) {
        List<String> functions = scope.type() == ScopeType.FUNCTION ? scope.functions() : List.of();
        return new CacheKey(document.uri(), document.version(), scope.type().keySegment(),
            scope.activeFilePath(), functions);
    }

    /**
     * Parses a rendered key.
     *
     * @param value rendered key
     * @return parsed key, or empty if the value has fewer than three segments, a malformed version
     *         or more than one path segment
     */
    public static Optional<CacheKey> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String[] parts = value.split(SEPARATOR, -1);
        if (parts.length < 3) {
            return Optional.empty();
        }
        Matcher version = VERSION_SEGMENT.matcher(parts[1]);
        if (!version.matches()) {
            return Optional.empty();
        }
        String activeFilePath = null;
        List<String> functions = List.of();
        for (int i = 3; i < parts.length; i++) {
            if (parts[i].startsWith(FUNCTIONS_PREFIX)) {
                functions = Arrays.asList(parts[i].substring(FUNCTIONS_PREFIX.length()).split(FUNCTION_SEPARATOR));
            } else if (activeFilePath == null) {
                activeFilePath = parts[i];
            } else {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(new CacheKey(
                parts[0],
                Integer.parseInt(version.group(1)),
                parts[2],
                activeFilePath,
                functions));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Renders the key.
     *
     * @return rendered key
     */
    public String value() {
        StringBuilder key = new StringBuilder(documentUri)
            .append(SEPARATOR).append('v').append(documentVersion)
            .append(SEPARATOR).append(scope);
        if (activeFilePath != null) {
            key.append(SEPARATOR).append(activeFilePath);
        }
        if (!functions.isEmpty()) {
            key.append(SEPARATOR).append(FUNCTIONS_PREFIX).append(String.join(FUNCTION_SEPARATOR, functions));
        }
        return key.toString();
    }

    @Override
    public String toString() {
        return value();
    }
}

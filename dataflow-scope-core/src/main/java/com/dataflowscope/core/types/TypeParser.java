package com.dataflowscope.core.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for generic dataflow type strings.
 *
 * <p>Works purely on the textual form of types reported by the type oracle, e.g.
 * {@code Stream<(String, i32), Tick<Process<'a, Leader>>, Bounded, TotalOrder>}. Parameters are
 * split on top-level commas only, so nested generics and tuples stay intact.
 *
 * <p>Malformed input never throws: unbalanced brackets are logged at WARN and the parser
 * returns whatever it could recover.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<String> params = TypeParser.parseTypeParameters("Stream<T, Process<'a, Leader>, Unbounded>");
 * // ["T", "Process<'a, Leader>", "Unbounded"]
 *
 * TypeParser.parseLocationType("Tick<Tick<Process<'a, Leader>>>");
 * // Optional[Tick<Tick<Process<Leader>>>]
 * }</pre>
 */
public final class TypeParser {

    private static final Logger log = LoggerFactory.getLogger(TypeParser.class);

    private static final String TICK_PREFIX = "Tick<";

    private static final Pattern REFERENCE_PREFIX = Pattern.compile("^&(?:mut\\s+)?");
    private static final Pattern COLLECTION_TYPE =
        Pattern.compile("^(KeyedStream|KeyedSingleton|Stream|Singleton|Optional)<(.+)>$");
    private static final Pattern IMPL_INTO = Pattern.compile("^impl\\s+Into<(.+)>$");
    private static final Pattern LOCATION_WITH_PARAM =
        Pattern.compile("(Process|Cluster|External)<\\s*(?:'[^,>]+,\\s*)?([^>,']+?)\\s*>");
    private static final Pattern LOCATION_CONSTRUCTOR = Pattern.compile("(Process|Cluster|External)<");
    private static final Pattern LEADING_LOCATION_CONSTRUCTOR = Pattern.compile("^(Process|Cluster|External)\\b");
    private static final Pattern LOCATION_LABEL = Pattern.compile("^(?:Process|Cluster|External)<([^>]+)>");
    private static final Pattern LIFETIME_PREFIX = Pattern.compile("^'[A-Za-z_]+,\\s*");
    private static final Pattern BOUNDEDNESS_GENERIC = Pattern.compile("^B\\b");
    private static final Pattern ORDERING_GENERIC = Pattern.compile("^O\\b");
    private static final Pattern ASSOCIATED_TYPE = Pattern.compile("<[^>]*\\bas\\b[^>]*<([^>]*)>[^>]*>::");

    private TypeParser() {
        // Utility class
    }

    /**
     * Parses the generic parameters of {@code Name<...>}.
     *
     * @param typeString full type string
     * @return top-level parameters, trimmed; empty if the string has no generic part
     */
    public static List<String> parseTypeParameters(String typeString) {
        if (typeString == null) {
            return List.of();
        }
        String trimmed = typeString.trim();
        int open = trimmed.indexOf('<');
        if (open <= 0) {
            return List.of();
        }

        String inner;
        if (trimmed.endsWith(">")) {
            inner = trimmed.substring(open + 1, trimmed.length() - 1);
        } else {
            log.warn("Type string has no closing '>', parsing best-effort: {}", typeString);
            inner = trimmed.substring(open + 1);
        }
        return splitTopLevel(inner);
    }

    /**
     * Splits a comma-separated parameter list, respecting nested {@code <>} and {@code ()}.
     *
     * @param params parameter list without the enclosing brackets
     * @return trimmed, non-empty parameters
     */
    public static List<String> splitTopLevel(String params) {
        if (params == null || params.isEmpty()) {
            return List.of();
        }

        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int angleDepth = 0;
        int parenDepth = 0;

        for (int i = 0; i < params.length(); i++) {
            char c = params.charAt(i);
            if (c == '<') {
                angleDepth++;
            } else if (c == '>') {
                angleDepth--;
            } else if (c == '(') {
                parenDepth++;
            } else if (c == ')') {
                parenDepth--;
            }

            if (angleDepth < 0 || parenDepth < 0) {
                log.warn("Unbalanced closing bracket at index {} in type parameters: {}", i, params);
                angleDepth = Math.max(angleDepth, 0);
                parenDepth = Math.max(parenDepth, 0);
            }

            if (c == ',' && angleDepth == 0 && parenDepth == 0) {
                addIfPresent(result, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(result, current);

        if (angleDepth != 0 || parenDepth != 0) {
            log.warn("Unclosed brackets in type parameters (angle={}, paren={}): {}", angleDepth, parenDepth, params);
        }
        return result;
    }

    /**
     * Derives boundedness from type parameters. A bare {@code B} generic defaults to unbounded.
     *
     * @param typeParams parameters from {@link #parseTypeParameters(String)}
     * @return boundedness of the first parameter that declares one
     */
    public static Optional<Boundedness> extractBoundedness(List<String> typeParams) {
        for (String param : typeParams) {
            String trimmed = param.trim();
            if (trimmed.startsWith("Bounded")) {
                return Optional.of(Boundedness.BOUNDED);
            }
            if (trimmed.startsWith("Unbounded")) {
                return Optional.of(Boundedness.UNBOUNDED);
            }
            if (BOUNDEDNESS_GENERIC.matcher(trimmed).find()) {
                return Optional.of(Boundedness.UNBOUNDED);
            }
        }
        return Optional.empty();
    }

    /**
     * Derives ordering from type parameters, including associated types such as
     * {@code <S as Ordered<TotalOrder>>::Order}. A bare {@code O} generic defaults to no order.
     *
     * @param typeParams parameters from {@link #parseTypeParameters(String)}
     * @return ordering of the first parameter that declares one
     */
    public static Optional<Ordering> extractOrdering(List<String> typeParams) {
        for (String param : typeParams) {
            String trimmed = param.trim();

            Matcher associated = ASSOCIATED_TYPE.matcher(trimmed);
            if (associated.find()) {
                String innerType = associated.group(1);
                if (innerType.contains("TotalOrder")) {
                    return Optional.of(Ordering.TOTAL_ORDER);
                }
                if (innerType.contains("NoOrder")) {
                    return Optional.of(Ordering.NO_ORDER);
                }
            }
            if (trimmed.contains("TotalOrder")) {
                return Optional.of(Ordering.TOTAL_ORDER);
            }
            if (trimmed.contains("NoOrder")) {
                return Optional.of(Ordering.NO_ORDER);
            }
            if (ORDERING_GENERIC.matcher(trimmed).find()) {
                return Optional.of(Ordering.NO_ORDER);
            }
        }
        return Optional.empty();
    }

    /**
     * Determines the outer live-collection constructor of a type, looking through references
     * and {@code impl Into<...>}.
     *
     * @param typeString return type
     * @return collection kind, or empty for non-collection types
     */
    public static Optional<CollectionKind> extractCollectionKind(String typeString) {
        return unwrapCollectionType(typeString)
            .map(collection -> {
                Matcher matcher = COLLECTION_TYPE.matcher(collection);
                return matcher.matches() ? CollectionKind.fromConstructor(matcher.group(1)) : null;
            });
    }

    /**
     * Returns the live-collection type inside a return type, without reference markers or an
     * {@code impl Into<...>} wrapper.
     *
     * @param typeString return type
     * @return collection type such as {@code Stream<T, L, B, O>}, or empty
     */
    public static Optional<String> unwrapCollectionType(String typeString) {
        if (typeString == null) {
            return Optional.empty();
        }
        String unwrapped = REFERENCE_PREFIX.matcher(typeString.trim()).replaceFirst("");
        Matcher impl = IMPL_INTO.matcher(unwrapped);
        if (impl.matches()) {
            unwrapped = impl.group(1).trim();
        }
        return COLLECTION_TYPE.matcher(unwrapped).matches() ? Optional.of(unwrapped) : Optional.empty();
    }

    /**
     * Normalises the location carried by a type.
     *
     * <p>Collection types delegate to their location parameter. Location constructors lose
     * their lifetime, and any {@code Tick<>} wrappers are re-applied around the result:
     * {@code Tick<Tick<Process<'a, Leader>>>} becomes {@code Tick<Tick<Process<Leader>>>}.
     *
     * @param fullType type string
     * @return normalised location kind, or empty for types that carry no location
     */
    public static Optional<String> parseLocationType(String fullType) {
        if (fullType == null || fullType.isBlank()) {
            return Optional.empty();
        }

        String unwrapped = REFERENCE_PREFIX.matcher(fullType.trim()).replaceFirst("");

        Matcher collection = COLLECTION_TYPE.matcher(unwrapped);
        if (collection.matches()) {
            CollectionKind kind = CollectionKind.fromConstructor(collection.group(1));
            List<String> params = splitTopLevel(collection.group(2));
            int locationIndex = kind.locationParameterIndex();
            if (params.size() > locationIndex) {
                return parseLocationType(params.get(locationIndex));
            }
        }

        int tickDepth = 0;
        String current = unwrapped;
        while (current.startsWith(TICK_PREFIX) && current.endsWith(">")) {
            current = current.substring(TICK_PREFIX.length(), current.length() - 1).trim();
            tickDepth++;
        }

        Matcher location = LOCATION_WITH_PARAM.matcher(current);
        if (location.find()) {
            return Optional.of(buildTickLabel(location.group(1) + "<" + location.group(2).trim() + ">", tickDepth));
        }

        Matcher constructor = LOCATION_CONSTRUCTOR.matcher(current);
        if (constructor.find()) {
            return Optional.of(buildTickLabel(constructor.group(1), tickDepth));
        }
        return Optional.empty();
    }

    /**
     * Counts the {@code Tick<>} wrappers around a location kind.
     *
     * @param locationKind normalised location kind
     * @return number of wrappers, 0 for a bare location
     */
    public static int countTickDepth(String locationKind) {
        int depth = 0;
        String current = locationKind.trim();
        while (current.startsWith(TICK_PREFIX) && current.endsWith(">")) {
            current = current.substring(TICK_PREFIX.length(), current.length() - 1).trim();
            depth++;
        }
        return depth;
    }

    /**
     * Removes every {@code Tick<>} wrapper, so all tick levels of a location normalise alike.
     *
     * @param locationKind location kind
     * @return innermost location
     */
    public static String stripTicks(String locationKind) {
        String current = locationKind.trim();
        while (current.startsWith(TICK_PREFIX) && current.endsWith(">")) {
            current = current.substring(TICK_PREFIX.length(), current.length() - 1).trim();
        }
        return current;
    }

    /**
     * Wraps a label in {@code depth} {@code Tick<>} wrappers.
     *
     * @param base inner label
     * @param depth wrapper count
     * @return wrapped label
     */
    public static String buildTickLabel(String base, int depth) {
        return TICK_PREFIX.repeat(Math.max(depth, 0)) + base + ">".repeat(Math.max(depth, 0));
    }

    /**
     * Extracts a human-readable label from a location kind: the location's type parameter
     * ({@code Leader} for {@code Tick<Process<'a, Leader>>}), else the bare constructor, else
     * the raw string.
     *
     * @param locationKind location kind
     * @return display label
     */
    public static String extractLocationLabel(String locationKind) {
        String inner = stripTicks(locationKind);

        Matcher labelled = LOCATION_LABEL.matcher(inner);
        if (labelled.find()) {
            String param = LIFETIME_PREFIX.matcher(labelled.group(1).trim()).replaceFirst("").trim();
            if (!param.isEmpty() && !param.startsWith("'")) {
                return param;
            }
        }

        Matcher constructor = LEADING_LOCATION_CONSTRUCTOR.matcher(inner);
        if (constructor.find()) {
            return constructor.group(1);
        }
        return locationKind;
    }

    /**
     * Returns the location constructor ({@code Process}, {@code Cluster} or {@code External})
     * of a location kind, looking through {@code Tick<>} wrappers.
     *
     * @param locationKind location kind
     * @return constructor name, or empty
     */
    public static Optional<String> extractLocationConstructor(String locationKind) {
        if (locationKind == null) {
            return Optional.empty();
        }
        Matcher constructor = LEADING_LOCATION_CONSTRUCTOR.matcher(stripTicks(locationKind));
        return constructor.find() ? Optional.of(constructor.group(1)) : Optional.empty();
    }

    /**
     * Stable non-negative id for a location, shared by all tick levels of that location.
     *
     * @param locationKind location kind
     * @return location id
     */
    public static int locationId(String locationKind) {
        int hash = stripTicks(locationKind).hashCode();
        return hash == Integer.MIN_VALUE ? 0 : Math.abs(hash);
    }

    private static void addIfPresent(List<String> result, StringBuilder current) {
        String trimmed = current.toString().trim();
        if (!trimmed.isEmpty()) {
            result.add(trimmed);
        }
    }
}

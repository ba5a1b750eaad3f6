package com.dataflowscope.core.operator;

import com.dataflowscope.core.config.OperatorConfig;
import com.dataflowscope.core.model.NodeType;
import com.dataflowscope.core.types.TypeParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration-backed classification of dataflow operators.
 *
 * <p>Answers whether an operator name (optionally with its return type) is a genuine
 * pipeline stage, and which {@link NodeType} it maps to. Instances are immutable; pass a
 * registry to every component that needs one instead of sharing global state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * OperatorRegistry registry = new OperatorRegistry(OperatorConfig.defaults());
 * registry.isNetworkingOperator("send_bincode");   // true
 * registry.inferNodeType("reduce");                  // AGGREGATION
 * registry.isValidDataflowOperator("tick", "Tick<Process<'a, Leader>>"); // false
 * }</pre>
 */
public class OperatorRegistry {

    private static final String UNIT_TYPE = "()";
    private static final String IMPL_INTO = "impl Into<";
    private static final List<String> LOCATION_TYPE_PREFIXES = List.of("Process<", "Cluster<", "Tick<", "Atomic<");

    /** Category name patterns, checked in declaration order. */
    private static final Map<NodeType, Set<String>> NODE_TYPE_PATTERNS = createNodeTypePatterns();

    private static final Set<String> LOCAL_ENDPOINT_OPERATORS =
        Set.of("source_iter", "source_stream", "source_stdin", "dest_sink", "for_each", "dest_file");

    private final OperatorConfig config;
    private final Set<String> networkingOperators;
    private final Set<String> coreDataflowOperators;
    private final Set<String> sinkOperators;

    /**
     * Creates a registry, filling unset lists of {@code config} from the defaults.
     *
     * @param config operator configuration
     */
    public OperatorRegistry(OperatorConfig config) {
        this.config = OperatorConfig.resolve(Optional.ofNullable(config));
        this.networkingOperators = Set.copyOf(this.config.networkingOperators());
        this.coreDataflowOperators = Set.copyOf(this.config.coreDataflowOperators());
        this.sinkOperators = Set.copyOf(this.config.sinkOperators());
    }

    /**
     * Creates a registry backed by the built-in catalogue.
     *
     * @return default registry
     */
    public static OperatorRegistry withDefaults() {
        return new OperatorRegistry(OperatorConfig.defaults());
    }

    public boolean isNetworkingOperator(String operatorName) {
        return networkingOperators.contains(operatorName);
    }

    /**
     * Checks name membership in the networking or core dataflow lists.
     *
     * @param operatorName operator name
     * @return true if the name is a known dataflow operator
     */
    public boolean isKnownDataflowOperator(String operatorName) {
        return isNetworkingOperator(operatorName) || coreDataflowOperators.contains(operatorName);
    }

    public boolean isSinkOperator(String operatorName) {
        return sinkOperators.contains(operatorName);
    }

    /**
     * Decides whether an operator call is a pipeline stage, given its return type if known.
     *
     * <p>Rules, first match wins:
     * <ol>
     *   <li>no return type: name membership</li>
     *   <li>return type mentions a live collection: accept</li>
     *   <li>return type is exactly unit: accept</li>
     *   <li>return type mentions unit and the name is a sink: accept</li>
     *   <li>{@code impl Into<Collection>}: accept</li>
     *   <li>networking operator: accept, even when the type is partial or location-only</li>
     *   <li>pure location or infrastructure type ({@code Process<}, {@code Tick<}, ...): reject</li>
     *   <li>otherwise: name membership</li>
     * </ol>
     *
     * <p>Networking operators are accepted on name alone because their return types often fail
     * to resolve under partial type inference. This trades precision for recall.
     *
     * @param operatorName operator name
     * @param returnType return type reported by the type oracle, or null
     * @return true if the call should become a graph node
     */
    public boolean isValidDataflowOperator(String operatorName, String returnType) {
        if (returnType == null || returnType.isBlank()) {
            return isKnownDataflowOperator(operatorName);
        }

        List<String> collectionTypes = config.collectionTypes();
        if (collectionTypes.stream().anyMatch(returnType::contains)) {
            return true;
        }

        if (returnType.trim().equals(UNIT_TYPE)) {
            return true;
        }
        if (returnType.contains(UNIT_TYPE) && isSinkOperator(operatorName)) {
            return true;
        }

        if (returnType.contains(IMPL_INTO)
            && collectionTypes.stream().anyMatch(type -> returnType.contains(type.replace("<", "")))) {
            return true;
        }

        if (isNetworkingOperator(operatorName)) {
            return true;
        }

        if (LOCATION_TYPE_PREFIXES.stream().anyMatch(returnType::contains)) {
            return false;
        }

        return isKnownDataflowOperator(operatorName);
    }

    /**
     * Maps an operator name to its node category; {@link NodeType#TRANSFORM} if none matches.
     *
     * @param operatorName operator name
     * @return node type
     */
    public NodeType inferNodeType(String operatorName) {
        for (Map.Entry<NodeType, Set<String>> entry : NODE_TYPE_PATTERNS.entrySet()) {
            if (entry.getValue().contains(operatorName)) {
                return entry.getKey();
            }
        }
        return NodeType.TRANSFORM;
    }

    /**
     * Returns the location constructor of a location kind.
     *
     * @param locationKind location kind such as {@code Tick<Cluster<Worker>>}
     * @return {@code Process}, {@code Cluster} or {@code External}, or empty
     */
    public Optional<String> getLocationType(String locationKind) {
        return TypeParser.extractLocationConstructor(locationKind);
    }

    /**
     * Location assumed for an operator whose type could not be resolved.
     *
     * <p>Plain sources and sinks run on a single process. Networking operators span
     * locations and have no default.
     *
     * @param operatorName operator name
     * @return default location constructor, or empty
     */
    public Optional<String> inferDefaultLocation(String operatorName) {
        if (isNetworkingOperator(operatorName)) {
            return Optional.empty();
        }
        if (LOCAL_ENDPOINT_OPERATORS.contains(operatorName)) {
            return Optional.of("Process");
        }
        return Optional.empty();
    }

    /**
     * Returns the resolved configuration.
     *
     * @return operator configuration
     */
    public OperatorConfig config() {
        return config;
    }

    private static Map<NodeType, Set<String>> createNodeTypePatterns() {
        Map<NodeType, Set<String>> patterns = new LinkedHashMap<>();
        patterns.put(NodeType.SOURCE, Set.of(
            "source_iter", "source_stream", "source_stdin", "recv_stream", "recv_bincode", "recv_bytes"));
        patterns.put(NodeType.SINK, Set.of(
            "dest_sink", "for_each", "inspect", "dest_file", "assert", "assert_eq"));
        patterns.put(NodeType.JOIN, Set.of(
            "join", "cross_product", "anti_join", "cross_join", "difference", "join_multiset"));
        patterns.put(NodeType.NETWORK, Set.of(
            "send_bincode", "broadcast_bincode", "demux_bincode", "round_robin_bincode",
            "send_bytes", "broadcast_bytes", "demux_bytes", "network"));
        patterns.put(NodeType.AGGREGATION, Set.of(
            "fold", "reduce", "fold_keyed", "reduce_keyed", "count", "sum", "min", "max", "sort", "sort_by"));
        patterns.put(NodeType.TEE, Set.of("tee", "persist", "clone"));
        return Collections.unmodifiableMap(patterns);
    }
}

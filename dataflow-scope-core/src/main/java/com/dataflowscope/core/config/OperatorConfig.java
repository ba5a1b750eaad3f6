package com.dataflowscope.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Operator name lists backing the operator registry.
 *
 * <p>A null list means "not configured" and is replaced by the matching list of
 * {@link #DEFAULTS} when the configuration is {@linkplain #resolve(Optional) resolved}.
 * An explicitly empty list stays empty.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * operators:
 *   networkingOperators: [send_bincode, recv_bincode]
 *   sinkOperators: [for_each, dest_sink]
 * }</pre>
 *
 * @param networkingOperators operators moving data between locations
 * @param coreDataflowOperators transformation, collection and scoping operators
 * @param sinkOperators operators consuming a collection and returning unit
 * @param collectionTypes live collection type prefixes such as {@code Stream<}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OperatorConfig(
    @JsonProperty("networkingOperators") List<String> networkingOperators,
    @JsonProperty("coreDataflowOperators") List<String> coreDataflowOperators,
    @JsonProperty("sinkOperators") List<String> sinkOperators,
    @JsonProperty("collectionTypes") List<String> collectionTypes
) {
    /**
     * Built-in operator catalogue.
     */
    public static final OperatorConfig DEFAULTS = new OperatorConfig(
        List.of(
            "send_bincode", "recv_bincode", "broadcast_bincode", "demux_bincode", "round_robin_bincode",
            "send_bincode_external", "recv_bincode_external",
            "send_bytes", "recv_bytes", "broadcast_bytes", "demux_bytes",
            "send_bytes_external", "recv_bytes_external",
            "connect", "disconnect"
        ),
        List.of(
            "map", "flat_map", "filter", "filter_map", "scan", "enumerate", "inspect", "unique", "sort",
            "fold", "reduce", "fold_keyed", "reduce_keyed", "reduce_watermark_commutative",
            "fold_commutative", "reduce_commutative", "fold_early_stop",
            "into_singleton", "into_stream", "into_keyed", "keys", "values", "entries",
            "collect_vec", "collect_ready", "all_ticks", "all_ticks_atomic",
            "join", "cross_product", "cross_singleton", "difference", "anti_join",
            "chain", "chain_first", "union", "concat", "zip",
            "defer_tick", "persist", "snapshot", "snapshot_atomic", "sample_every", "sample_eager",
            "timeout", "batch", "yield_concat",
            "source_iter", "source_stream", "source_stdin",
            "for_each", "dest_sink", "assert", "assert_eq", "dest_file",
            "tee", "clone", "unwrap", "unwrap_or", "filter_if_some", "filter_if_none",
            "resolve_futures", "resolve_futures_ordered",
            "tick", "atomic", "complete", "complete_next_tick", "first", "last"
        ),
        List.of("for_each", "dest_sink", "assert", "assert_eq", "dest_file"),
        List.of("Stream<", "Singleton<", "Optional<", "KeyedStream<", "KeyedSingleton<")
    );

    /**
     * Compact constructor copying configured lists.
     */
    public OperatorConfig {
        networkingOperators = copyOrNull(networkingOperators);
        coreDataflowOperators = copyOrNull(coreDataflowOperators);
        sinkOperators = copyOrNull(sinkOperators);
        collectionTypes = copyOrNull(collectionTypes);
    }

    /**
     * Returns the built-in operator catalogue.
     *
     * @return default configuration
     */
    public static OperatorConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Layers an optional configuration over {@link #DEFAULTS}, list by list.
     *
     * @param override configured operators, possibly partial
     * @return fully populated configuration
     */
    public static OperatorConfig resolve(Optional<OperatorConfig> override) {
        return override
            .map(config -> new OperatorConfig(
                orDefault(config.networkingOperators, DEFAULTS.networkingOperators),
                orDefault(config.coreDataflowOperators, DEFAULTS.coreDataflowOperators),
                orDefault(config.sinkOperators, DEFAULTS.sinkOperators),
                orDefault(config.collectionTypes, DEFAULTS.collectionTypes)))
            .orElse(DEFAULTS);
    }

    private static List<String> copyOrNull(List<String> values) {
        return values == null ? null : List.copyOf(values);
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        return configured != null ? configured : fallback;
    }
}

package com.dataflowscope.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Root configuration for Dataflow Scope.
 *
 * <p>Loaded from {@code dataflowscope.yaml}. Every section is optional; missing sections
 * and values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * operators:
 *   networkingOperators: [send_bincode, recv_bincode]
 *
 * cache:
 *   maxSize: 100
 *
 * analysis:
 *   typeMatchTolerance: 300
 *   maxLabelLength: 80
 * }</pre>
 *
 * @param operators operator catalogue, resolved over the defaults
 * @param cache extraction cache settings
 * @param analysis graph construction settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("operators") OperatorConfig operators,
    @JsonProperty("cache") CacheConfig cache,
    @JsonProperty("analysis") AnalysisConfig analysis
) {
    /**
     * Compact constructor resolving missing sections to defaults.
     */
    public ProjectConfig {
        operators = OperatorConfig.resolve(Optional.ofNullable(operators));
        if (cache == null) {
            cache = CacheConfig.defaults();
        }
        if (analysis == null) {
            analysis = AnalysisConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(OperatorConfig.defaults(), CacheConfig.defaults(), AnalysisConfig.defaults());
    }

    /**
     * Extraction cache settings.
     *
     * @param maxSize maximum number of cached graphs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheConfig(
        @JsonProperty("maxSize") int maxSize
    ) {
        public static final int DEFAULT_MAX_SIZE = 50;

        /**
         * Compact constructor replacing non-positive sizes with the default.
         */
        public CacheConfig {
            if (maxSize <= 0) {
                maxSize = DEFAULT_MAX_SIZE;
            }
        }

        public static CacheConfig defaults() {
            return new CacheConfig(DEFAULT_MAX_SIZE);
        }
    }

    /**
     * Graph construction settings.
     *
     * @param typeMatchTolerance exclusive upper bound of the {@code |dLine| * 100 + |dColumn|}
     *                           distance when matching type annotations to operators
     * @param maxLabelLength maximum length of a node's full label
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("typeMatchTolerance") int typeMatchTolerance,
        @JsonProperty("maxLabelLength") int maxLabelLength
    ) {
        public static final int DEFAULT_TYPE_MATCH_TOLERANCE = 300;
        public static final int DEFAULT_MAX_LABEL_LENGTH = 80;

        /**
         * Compact constructor replacing non-positive values with defaults.
         */
        public AnalysisConfig {
            if (typeMatchTolerance <= 0) {
                typeMatchTolerance = DEFAULT_TYPE_MATCH_TOLERANCE;
            }
            if (maxLabelLength <= 0) {
                maxLabelLength = DEFAULT_MAX_LABEL_LENGTH;
            }
        }

        public static AnalysisConfig defaults() {
            return new AnalysisConfig(DEFAULT_TYPE_MATCH_TOLERANCE, DEFAULT_MAX_LABEL_LENGTH);
        }
    }
}

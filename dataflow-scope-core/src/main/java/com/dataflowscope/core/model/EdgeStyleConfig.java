package com.dataflowscope.core.model;

import java.util.List;
import java.util.Map;

/**
 * Mapping from semantic edge tags to visual channels, consumed by the renderer.
 *
 * @param note free-form description
 * @param semanticMappings group name to tag name to style properties
 * @param semanticPriorities tag pairs ordered by precedence when styles conflict
 */
public record EdgeStyleConfig(
    String note,
    Map<String, Map<String, Map<String, String>>> semanticMappings,
    List<List<String>> semanticPriorities
) {
    /**
     * Compact constructor with defaults.
     */
    public EdgeStyleConfig {
        semanticMappings = semanticMappings == null ? Map.of() : semanticMappings;
        semanticPriorities = semanticPriorities == null ? List.of() : semanticPriorities;
    }
}

package com.dataflowscope.core.pipeline;

import com.dataflowscope.core.model.EdgeStyleConfig;
import com.dataflowscope.core.model.Legend;
import com.dataflowscope.core.model.NodeType;
import com.dataflowscope.core.model.NodeTypeConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static styling metadata attached to every extracted graph.
 *
 * <p>The engine never interprets these values; they tell the viewer how semantic edge tags
 * and node types map to visual channels.
 */
public final class VisualizationMetadata {

    private static final String EDGE_STYLE_NOTE =
        "Edge styles are computed per edge from its semantic tags. This mapping is provided for reference.";

    private static final EdgeStyleConfig EDGE_STYLE_CONFIG = createEdgeStyleConfig();
    private static final NodeTypeConfig NODE_TYPE_CONFIG = createNodeTypeConfig();
    private static final Legend LEGEND = createLegend();

    private VisualizationMetadata() {
        // Utility class
    }

    public static EdgeStyleConfig edgeStyleConfig() {
        return EDGE_STYLE_CONFIG;
    }

    public static NodeTypeConfig nodeTypeConfig() {
        return NODE_TYPE_CONFIG;
    }

    public static Legend legend() {
        return LEGEND;
    }

    private static EdgeStyleConfig createEdgeStyleConfig() {
        Map<String, Map<String, Map<String, String>>> mappings = new LinkedHashMap<>();
        mappings.put("BoundednessGroup", group(
            "Bounded", style("halo", "none"),
            "Unbounded", style("halo", "light-blue")));

        Map<String, Map<String, String>> collection = new LinkedHashMap<>();
        collection.put("Stream", style("arrowhead", "triangle-filled", "color-token", "highlight-1"));
        collection.put("Singleton", style("arrowhead", "circle-filled", "color-token", "default"));
        collection.put("Optional", style("arrowhead", "diamond-open", "color-token", "muted"));
        mappings.put("CollectionGroup", Collections.unmodifiableMap(collection));

        mappings.put("KeyednessGroup", group(
            "NotKeyed", style("line-style", "single"),
            "Keyed", style("line-style", "hash-marks")));
        mappings.put("NetworkGroup", group(
            "Local", style("line-pattern", "solid", "animation", "static"),
            "Network", style("line-pattern", "dashed", "animation", "animated")));
        mappings.put("OrderingGroup", group(
            "TotalOrder", style("waviness", "none"),
            "NoOrder", style("waviness", "wavy")));

        List<List<String>> priorities = List.of(
            List.of("Unbounded", "Bounded"),
            List.of("NoOrder", "TotalOrder"),
            List.of("Keyed", "NotKeyed"),
            List.of("Network", "Local"));

        return new EdgeStyleConfig(EDGE_STYLE_NOTE, Collections.unmodifiableMap(mappings), priorities);
    }

    private static NodeTypeConfig createNodeTypeConfig() {
        List<NodeTypeConfig.TypeStyle> types = new ArrayList<>();
        List<NodeType> ordered = sortedNodeTypes();
        for (int i = 0; i < ordered.size(); i++) {
            String label = ordered.get(i).label();
            types.add(new NodeTypeConfig.TypeStyle(label, label, i));
        }
        return new NodeTypeConfig(NodeType.TRANSFORM.label(), types);
    }

    private static Legend createLegend() {
        List<Legend.Item> items = sortedNodeTypes().stream()
            .map(type -> new Legend.Item(type.label(), type.label()))
            .toList();
        return new Legend("Node Types", items);
    }

    private static List<NodeType> sortedNodeTypes() {
        return Arrays.stream(NodeType.values())
            .sorted(Comparator.comparing(NodeType::label))
            .toList();
    }

    private static Map<String, Map<String, String>> group(String firstTag, Map<String, String> firstStyle,
                                                          String secondTag, Map<String, String> secondStyle) {
        Map<String, Map<String, String>> group = new LinkedHashMap<>();
        group.put(firstTag, firstStyle);
        group.put(secondTag, secondStyle);
        return Collections.unmodifiableMap(group);
    }

    private static Map<String, String> style(String... keyValues) {
        Map<String, String> style = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            style.put(keyValues[i], keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(style);
    }
}

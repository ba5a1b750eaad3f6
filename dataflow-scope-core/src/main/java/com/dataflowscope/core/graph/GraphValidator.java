package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.DataflowGraph;
import com.dataflowscope.core.model.GraphEdge;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.Hierarchy;
import com.dataflowscope.core.model.HierarchyContainer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on an assembled graph.
 *
 * <p>Validation is advisory: issues are returned as messages and the caller decides whether
 * to log, reject or render the graph anyway.
 */
public class GraphValidator {

    /**
     * Validates a graph.
     *
     * @param graph graph to check
     * @return human-readable issues, empty if the graph is well-formed
     */
    public List<String> validate(DataflowGraph graph) {
        List<String> issues = new ArrayList<>();
        Set<String> nodeIds = new HashSet<>();
        Set<String> edgeIds = new HashSet<>();

        for (GraphNode node : graph.nodes()) {
            if (!nodeIds.add(node.id().toString())) {
                issues.add("Duplicate node id " + node.id());
            }
            if (node.nodeType() == null) {
                issues.add("Node " + node.id() + " is missing nodeType");
            }
            if (isBlank(node.shortLabel())) {
                issues.add("Node " + node.id() + " is missing shortLabel");
            }
        }

        for (int i = 0; i < graph.edges().size(); i++) {
            GraphEdge edge = graph.edges().get(i);
            String edgeName = isBlank(edge.id()) ? "at index " + i : edge.id();
            if (isBlank(edge.id())) {
                issues.add("Edge at index " + i + " is missing id");
            } else if (!edgeIds.add(edge.id())) {
                issues.add("Duplicate edge id " + edge.id());
            }
            if (edge.source() == null) {
                issues.add("Edge " + edgeName + " is missing source");
            } else if (!nodeIds.contains(edge.source().toString())) {
                issues.add("Edge " + edgeName + " references non-existent source node " + edge.source());
            }
            if (edge.target() == null) {
                issues.add("Edge " + edgeName + " is missing target");
            } else if (!nodeIds.contains(edge.target().toString())) {
                issues.add("Edge " + edgeName + " references non-existent target node " + edge.target());
            }
        }

        for (Hierarchy hierarchy : graph.hierarchyChoices()) {
            if (isBlank(hierarchy.id()) || isBlank(hierarchy.name())) {
                issues.add("Hierarchy is missing id or name: " + hierarchy.id());
            }
            for (HierarchyContainer container : hierarchy.children()) {
                checkContainer(container, issues);
            }
        }

        for (Map.Entry<String, Map<String, String>> assignments : graph.nodeAssignments().entrySet()) {
            for (String nodeId : assignments.getValue().keySet()) {
                if (!nodeIds.contains(nodeId)) {
                    issues.add("Hierarchy " + assignments.getKey() + " assigns non-existent node " + nodeId);
                }
            }
        }

        return issues;
    }

    private static void checkContainer(HierarchyContainer container, List<String> issues) {
        if (isBlank(container.name())) {
            issues.add("Hierarchy container " + container.id() + " is missing name");
        }
        for (HierarchyContainer child : container.children()) {
            checkContainer(child, issues);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

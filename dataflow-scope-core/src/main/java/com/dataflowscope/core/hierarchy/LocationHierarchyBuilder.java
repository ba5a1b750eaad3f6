package com.dataflowscope.core.hierarchy;

import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.Hierarchy;
import com.dataflowscope.core.model.HierarchyContainer;
import com.dataflowscope.core.model.NodeId;
import com.dataflowscope.core.types.TypeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups nodes by runtime location, with nested containers for tick scopes.
 *
 * <p>Each distinct location label ({@code Leader} for {@code Process<'a, Leader>}) becomes a
 * root container. Nodes inside {@code Tick<>} wrappers are partitioned level by level by
 * their tick variable; a node of tick depth {@code d} takes part in levels {@code 1..d} and is
 * assigned to its level-{@code d} container. Nodes without a location kind land in an
 * {@code (unknown location)} container.
 *
 * <p>Example for {@code Tick<Tick<Process<Leader>>>} with tick variable {@code main::inner}:
 * <pre>
 * Leader
 *   inner          (level 1)
 *     inner        (level 2, holds the node)
 * </pre>
 */
public class LocationHierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(LocationHierarchyBuilder.class);

    public static final String HIERARCHY_ID = "location";
    public static final String HIERARCHY_NAME = "Location";
    public static final String UNKNOWN_LOCATION = "(unknown location)";
    public static final String DEFAULT_CONTAINER = "(default)";

    private static final String ID_PREFIX = "loc_";
    private static final String UNKNOWN_TICK = "_unknown_";
    private static final String SCOPE_SEPARATOR = "::";

    /**
     * Builds the location hierarchy.
     *
     * @param nodes graph nodes
     * @return hierarchy with one assignment per node
     */
    public HierarchyResult build(List<GraphNode> nodes) {
        ContainerArena arena = new ContainerArena(ID_PREFIX);
        List<Integer> roots = new ArrayList<>();
        Map<NodeId, Integer> assignments = new LinkedHashMap<>();

        Map<String, List<GraphNode>> nodesByBase = new LinkedHashMap<>();
        Map<NodeId, Integer> depthById = new HashMap<>();
        List<GraphNode> unknownNodes = new ArrayList<>();

        for (GraphNode node : nodes) {
            String kind = node.data().locationKind();
            if (kind == null || kind.isBlank()) {
                unknownNodes.add(node);
                continue;
            }
            String base = TypeParser.extractLocationLabel(kind);
            depthById.put(node.id(), TypeParser.countTickDepth(kind));
            nodesByBase.computeIfAbsent(base, key -> new ArrayList<>()).add(node);
        }

        for (Map.Entry<String, List<GraphNode>> group : nodesByBase.entrySet()) {
            int root = arena.create(group.getKey());
            roots.add(root);
            buildBaseGroup(arena, root, group.getKey(), group.getValue(), depthById, assignments);
        }

        if (!unknownNodes.isEmpty()) {
            int unknown = arena.create(UNKNOWN_LOCATION);
            roots.add(unknown);
            for (GraphNode node : unknownNodes) {
                assignments.put(node.id(), unknown);
            }
            log.warn("DEGRADED MODE: {} node(s) without location information assigned to '{}'",
                unknownNodes.size(), arena.id(unknown));
        }

        if (roots.isEmpty()) {
            roots.add(arena.create(DEFAULT_CONTAINER));
            log.warn("DEGRADED MODE: no location groups found, created fallback container");
        }

        List<HierarchyContainer> children = roots.stream().map(arena::materialize).toList();
        Map<String, String> resolved = new LinkedHashMap<>();
        assignments.forEach((nodeId, slot) -> resolved.put(nodeId.toString(), arena.id(arena.resolve(slot))));

        log.debug("Location hierarchy: {} root container(s), {} container(s) total", roots.size(), arena.size());
        return new HierarchyResult(new Hierarchy(HIERARCHY_ID, HIERARCHY_NAME, children), resolved);
    }

    private void buildBaseGroup(ContainerArena arena, int root, String base, List<GraphNode> baseNodes,
                                Map<NodeId, Integer> depthById, Map<NodeId, Integer> assignments) {
        int maxDepth = baseNodes.stream().mapToInt(node -> depthById.get(node.id())).max().orElse(0);
        Map<Integer, Map<NodeId, Integer>> containerByLevel = new HashMap<>();

        for (int level = 1; level <= maxDepth; level++) {
            Map<String, List<NodeId>> byTickVariable = new LinkedHashMap<>();
            for (GraphNode node : baseNodes) {
                if (depthById.get(node.id()) >= level) {
                    String tickVariable = node.data().tickVariable();
                    String key = tickVariable == null || tickVariable.isBlank() ? UNKNOWN_TICK : tickVariable;
                    byTickVariable.computeIfAbsent(key, k -> new ArrayList<>()).add(node.id());
                }
            }

            Map<NodeId, Integer> previousLevel = containerByLevel.getOrDefault(level - 1, Map.of());
            Map<NodeId, Integer> thisLevel = new HashMap<>();
            for (Map.Entry<String, List<NodeId>> group : byTickVariable.entrySet()) {
                int parent = level == 1 ? root : parentOf(group.getValue(), previousLevel, root, base, level);
                String label = UNKNOWN_TICK.equals(group.getKey())
                    ? TypeParser.buildTickLabel(base, level)
                    : unqualified(group.getKey());
                int container = arena.createChild(label, parent);
                for (NodeId nodeId : group.getValue()) {
                    thisLevel.put(nodeId, container);
                }
            }
            containerByLevel.put(level, thisLevel);
        }

        for (GraphNode node : baseNodes) {
            int depth = depthById.get(node.id());
            int container = depth == 0
                ? root
                : containerByLevel.getOrDefault(depth, Map.of()).getOrDefault(node.id(), root);
            assignments.put(node.id(), container);
        }
    }

    private static int parentOf(List<NodeId> members, Map<NodeId, Integer> previousLevel,
                                int root, String base, int level) {
        for (NodeId member : members) {
            Integer parent = previousLevel.get(member);
            if (parent != null) {
                return parent;
            }
        }
        log.warn("No level-{} parent for tick container in '{}', attaching to location root", level - 1, base);
        return root;
    }

    private static String unqualified(String tickVariable) {
        int separator = tickVariable.lastIndexOf(SCOPE_SEPARATOR);
        return separator >= 0 ? tickVariable.substring(separator + SCOPE_SEPARATOR.length()) : tickVariable;
    }
}

package com.dataflowscope.core.hierarchy;

import com.dataflowscope.core.graph.FunctionResolver;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.Hierarchy;
import com.dataflowscope.core.model.NodeId;
import com.dataflowscope.core.model.OperatorCall;
import com.dataflowscope.core.model.OperatorChain;
import com.dataflowscope.core.model.SourceDocument;
import com.dataflowscope.core.model.SourcePosition;
import com.dataflowscope.core.model.VariableBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups nodes by source structure: file, then function, then bound variable.
 *
 * <p>Nodes of a variable-bound chain go to that variable's container, nodes of standalone
 * chains go to their function's container, and anything left goes to the file container.
 * A variable assignment is never overridden by a standalone one. Empty containers are left
 * out, then single-child chains below the file container collapse into one container named
 * {@code fn main→counts}.
 */
public class CodeHierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(CodeHierarchyBuilder.class);

    public static final String HIERARCHY_ID = "code";
    public static final String HIERARCHY_NAME = "Code";

    private static final String ID_PREFIX = "code_";
    private static final String FUNCTION_PREFIX = "fn ";

    /**
     * Builds the code hierarchy.
     *
     * @param document analysed document, names the file container
     * @param nodes graph nodes
     * @param bindings variable-bound chains the nodes came from
     * @param standaloneChains standalone chains the nodes came from
     * @param functions enclosing-function lookup
     * @return hierarchy with one assignment per node
     */
    public HierarchyResult build(SourceDocument document,
                                 List<GraphNode> nodes,
                                 List<VariableBinding> bindings,
                                 List<OperatorChain> standaloneChains,
                                 FunctionResolver functions) {
        ContainerArena arena = new ContainerArena(ID_PREFIX);
        int file = arena.create(document.baseName());

        Map<String, Integer> functionSlots = new LinkedHashMap<>();
        Map<Integer, List<Integer>> variablesByFunction = new HashMap<>();
        Map<String, Integer> variableSlots = new HashMap<>();
        Map<NodeId, Integer> assignments = new LinkedHashMap<>();
        Map<PositionKey, NodeId> nodesByPosition = indexByPosition(nodes);

        for (VariableBinding binding : bindings) {
            int function = functionSlot(arena, functionSlots,
                functions.enclosingFunctionOrTopLevel(binding.declarationLine()));
            int variable = variableSlots.computeIfAbsent(function + ":" + binding.variableName(), key -> {
                int slot = arena.create(binding.variableName());
                variablesByFunction.computeIfAbsent(function, f -> new ArrayList<>()).add(slot);
                return slot;
            });
            assignChain(arena, binding.operators(), variable, nodesByPosition, assignments);
        }

        for (OperatorChain chain : standaloneChains) {
            if (chain.operators().isEmpty()) {
                continue;
            }
            int function = functionSlot(arena, functionSlots,
                functions.enclosingFunctionOrTopLevel(chain.operators().get(0).line()));
            assignChain(arena, chain.operators(), function, nodesByPosition, assignments);
        }

        for (GraphNode node : nodes) {
            if (!assignments.containsKey(node.id())) {
                assignments.put(node.id(), file);
                arena.bump(file);
            }
        }

        for (int function : functionSlots.values()) {
            List<Integer> nonEmptyVariables = variablesByFunction.getOrDefault(function, List.of()).stream()
                .filter(variable -> arena.directAssignments(variable) > 0)
                .toList();
            if (arena.directAssignments(function) > 0 || !nonEmptyVariables.isEmpty()) {
                arena.attach(file, function);
                nonEmptyVariables.forEach(variable -> arena.attach(function, variable));
            }
        }

        int merges = arena.collapseSingleChildChains(file);
        log.debug("Code hierarchy: {} function container(s), {} collapse merge(s)", functionSlots.size(), merges);

        Map<String, String> resolved = new LinkedHashMap<>();
        assignments.forEach((nodeId, slot) -> resolved.put(nodeId.toString(), arena.id(arena.resolve(slot))));
        Hierarchy hierarchy = new Hierarchy(HIERARCHY_ID, HIERARCHY_NAME, List.of(arena.materialize(file)));
        return new HierarchyResult(hierarchy, resolved);
    }

    private static int functionSlot(ContainerArena arena, Map<String, Integer> functionSlots, String functionName) {
        return functionSlots.computeIfAbsent(FUNCTION_PREFIX + functionName, arena::create);
    }

    private static void assignChain(ContainerArena arena, List<OperatorCall> operators, int container,
                                    Map<PositionKey, NodeId> nodesByPosition, Map<NodeId, Integer> assignments) {
        for (OperatorCall call : operators) {
            NodeId nodeId = nodesByPosition.get(new PositionKey(call.line(), call.column(), call.name()));
            if (nodeId != null && !assignments.containsKey(nodeId)) {
                assignments.put(nodeId, container);
                arena.bump(container);
            }
        }
    }

    private static Map<PositionKey, NodeId> indexByPosition(List<GraphNode> nodes) {
        Map<PositionKey, NodeId> index = new HashMap<>();
        for (GraphNode node : nodes) {
            SourcePosition position = node.data().sourcePosition();
            if (position != null) {
                index.put(new PositionKey(position.line(), position.column(), node.shortLabel()), node.id());
            }
        }
        return index;
    }

    private record PositionKey(int line, int column, String name) {
    }
}

package com.dataflowscope.core.hierarchy;

import com.dataflowscope.core.graph.FunctionResolver;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.HierarchyData;
import com.dataflowscope.core.model.OperatorChain;
import com.dataflowscope.core.model.SourceDocument;
import com.dataflowscope.core.model.VariableBinding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the location and code hierarchies of a graph.
 *
 * <p>The location hierarchy is selected by default.
 */
public class HierarchyBuilder {

    private final LocationHierarchyBuilder locationBuilder;
    private final CodeHierarchyBuilder codeBuilder;

    public HierarchyBuilder() {
        this(new LocationHierarchyBuilder(), new CodeHierarchyBuilder());
    }

    public HierarchyBuilder(LocationHierarchyBuilder locationBuilder, CodeHierarchyBuilder codeBuilder) {
        this.locationBuilder = locationBuilder;
        this.codeBuilder = codeBuilder;
    }

    /**
     * Builds both hierarchies.
     *
     * @param document analysed document
     * @param nodes graph nodes
     * @param bindings variable-bound chains
     * @param standaloneChains standalone chains
     * @param functions enclosing-function lookup
     * @return hierarchy choices with their node assignments
     */
    public HierarchyData build(SourceDocument document,
                               List<GraphNode> nodes,
                               List<VariableBinding> bindings,
                               List<OperatorChain> standaloneChains,
                               FunctionResolver functions) {
        HierarchyResult location = locationBuilder.build(nodes);
        HierarchyResult code = codeBuilder.build(document, nodes, bindings, standaloneChains, functions);

        Map<String, Map<String, String>> assignments = new LinkedHashMap<>();
        assignments.put(LocationHierarchyBuilder.HIERARCHY_ID, location.assignments());
        assignments.put(CodeHierarchyBuilder.HIERARCHY_ID, code.assignments());

        return new HierarchyData(
            List.of(location.hierarchy(), code.hierarchy()),
            assignments,
            LocationHierarchyBuilder.HIERARCHY_ID
        );
    }
}

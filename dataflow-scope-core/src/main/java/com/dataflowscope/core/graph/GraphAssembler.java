package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.GraphBuildResult;
import com.dataflowscope.core.model.GraphEdge;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.NodeData;
import com.dataflowscope.core.model.NodeId;
import com.dataflowscope.core.model.OperatorCall;
import com.dataflowscope.core.model.OperatorChain;
import com.dataflowscope.core.model.SourceDocument;
import com.dataflowscope.core.model.TypeAnnotation;
import com.dataflowscope.core.model.VariableBinding;
import com.dataflowscope.core.operator.OperatorRegistry;
import com.dataflowscope.core.types.TypeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns operator chains into a deduplicated node and edge set.
 *
 * <p>One node is created per distinct {@code (line, column, name)} call site whose operator
 * the {@link OperatorRegistry} accepts. Rejected operators are skipped and the edge bridges
 * from the nearest retained predecessor to the nearest retained successor. A chain whose
 * receiver is a previously bound variable gets an extra edge from that variable's last node.
 *
 * <p>Variable-bound chains are processed before standalone ones, and only bound chains
 * register their last node as a variable producer. Self-loops and repeated
 * {@code (source, target)} pairs are not emitted.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GraphAssembler assembler = new GraphAssembler(registry, new FullLabelExtractor(80));
 * GraphBuildResult graph = assembler.build(document, snapshot.bindings(),
 *     snapshot.standaloneChains(), FunctionResolver.fromSpans(snapshot.functions()), typeIndex);
 * }</pre>
 */
public class GraphAssembler {

    private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

    private final OperatorRegistry registry;
    private final FullLabelExtractor labelExtractor;
    private final VariableReferenceDetector referenceDetector;

    public GraphAssembler(OperatorRegistry registry, FullLabelExtractor labelExtractor) {
        this(registry, labelExtractor, new VariableReferenceDetector());
    }

    /**
     * Creates an assembler.
     *
     * @param registry operator classification
     * @param labelExtractor call-site label rendering
     * @param referenceDetector cross-statement receiver detection
     */
    public GraphAssembler(OperatorRegistry registry, FullLabelExtractor labelExtractor,
                          VariableReferenceDetector referenceDetector) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.labelExtractor = Objects.requireNonNull(labelExtractor, "labelExtractor must not be null");
        this.referenceDetector = Objects.requireNonNull(referenceDetector, "referenceDetector must not be null");
    }

    /**
     * Builds the graph for one document.
     *
     * @param document source document, used for labels and receiver detection
     * @param bindings variable-bound chains
     * @param standaloneChains unbound chains
     * @param functions enclosing-function lookup, used to qualify tick variables
     * @param typeIndex type annotations, possibly empty
     * @return nodes in creation order and edges in emission order
     */
    public GraphBuildResult build(SourceDocument document,
                                  List<VariableBinding> bindings,
                                  List<OperatorChain> standaloneChains,
                                  FunctionResolver functions,
                                  TypeAnnotationIndex typeIndex) {
        log.debug("Building graph for {} from {} variable chains and {} standalone chains",
            document.uri(), bindings.size(), standaloneChains.size());

        BuildState state = new BuildState(document, functions, typeIndex);

        for (VariableBinding binding : bindings) {
            List<NodeId> retained = processChain(state, binding.operators());
            if (!retained.isEmpty()) {
                NodeId last = retained.get(retained.size() - 1);
                state.producers.put(binding.variableName(), last);
                log.debug("Variable '{}' produced by node {}", binding.variableName(), last);
            }
        }

        for (OperatorChain chain : standaloneChains) {
            processChain(state, chain.operators());
        }

        log.debug("Built {} nodes and {} edges", state.nodes.size(), state.edges.size());
        return new GraphBuildResult(state.nodes, state.edges);
    }

    private List<NodeId> processChain(BuildState state, List<OperatorCall> operators) {
        List<NodeId> retained = new ArrayList<>();
        for (OperatorCall call : operators) {
            getOrCreateNode(state, call).ifPresent(retained::add);
        }
        if (retained.isEmpty()) {
            return retained;
        }

        Optional<String> referenced = referenceDetector.detect(state.document, operators.get(0), state.producers.keySet());
        referenced.ifPresent(variable -> {
            NodeId producer = state.producers.get(variable);
            log.debug("Chain at line {} reads variable '{}'", operators.get(0).line(), variable);
            addEdge(state, producer, retained.get(0));
        });

        for (int i = 0; i < retained.size() - 1; i++) {
            addEdge(state, retained.get(i), retained.get(i + 1));
        }
        return retained;
    }

    private Optional<NodeId> getOrCreateNode(BuildState state, OperatorCall call) {
        NodeKey key = new NodeKey(call.line(), call.column(), call.name());
        NodeId existing = state.nodeIndex.get(key);
        if (existing != null) {
            return Optional.of(existing);
        }

        Optional<TypeAnnotation> annotation = state.typeIndex.match(call.name(), call.position());
        String returnType = annotation.map(TypeAnnotation::returnType).orElse(null);
        if (!registry.isValidDataflowOperator(call.name(), returnType)) {
            log.debug("Skipping non-dataflow operator {} at {}:{}", call.name(), call.line(), call.column());
            return Optional.empty();
        }

        NodeId id = new NodeId(state.nodes.size());
        NodeData data = NodeData.at(call.position());
        if (call.tickArgument() != null && !call.tickArgument().isBlank()) {
            String function = state.functions.enclosingFunctionOrTopLevel(call.line());
            data = data.withTickVariable(function + "::" + call.tickArgument());
        }
        if (annotation.isPresent()) {
            data = applyLocation(data, call.name(), annotation.get());
        }

        GraphNode node = new GraphNode(
            id,
            registry.inferNodeType(call.name()),
            call.name(),
            labelExtractor.extract(state.document, call),
            call.name(),
            data
        );
        state.nodes.add(node);
        state.nodeIndex.put(key, id);
        return Optional.of(id);
    }

    private NodeData applyLocation(NodeData data, String operatorName, TypeAnnotation annotation) {
        Optional<String> locationKind = TypeParser.parseLocationType(annotation.returnType())
            .or(() -> TypeParser.parseLocationType(annotation.locationType()));
        if (locationKind.isPresent()) {
            String kind = locationKind.get();
            return data.withLocation(
                TypeParser.locationId(kind),
                registry.getLocationType(kind).orElse(null),
                kind,
                annotation.returnType());
        }
        return data.withLocation(null, registry.inferDefaultLocation(operatorName).orElse(null),
            null, annotation.returnType());
    }

    private void addEdge(BuildState state, NodeId source, NodeId target) {
        if (source.equals(target)) {
            return;
        }
        if (state.edgeKeys.add(new EdgeKey(source, target))) {
            state.edges.add(GraphEdge.between(Integer.toString(state.edges.size()), source, target));
        }
    }

    private record NodeKey(int line, int column, String name) {
    }

    private record EdgeKey(NodeId source, NodeId target) {
    }

    /**
     * Mutable bookkeeping of a single build.
     */
    private static final class BuildState {
        private final SourceDocument document;
        private final FunctionResolver functions;
        private final TypeAnnotationIndex typeIndex;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final Map<NodeKey, NodeId> nodeIndex = new HashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();
        private final Set<EdgeKey> edgeKeys = new HashSet<>();
        private final Map<String, NodeId> producers = new LinkedHashMap<>();

        private BuildState(SourceDocument document, FunctionResolver functions, TypeAnnotationIndex typeIndex) {
            this.document = document;
            this.functions = functions;
            this.typeIndex = typeIndex;
        }
    }
}

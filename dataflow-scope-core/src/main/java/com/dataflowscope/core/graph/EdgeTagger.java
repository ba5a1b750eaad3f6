package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.GraphEdge;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.NodeId;
import com.dataflowscope.core.operator.OperatorRegistry;
import com.dataflowscope.core.types.Boundedness;
import com.dataflowscope.core.types.CollectionKind;
import com.dataflowscope.core.types.Ordering;
import com.dataflowscope.core.types.TypeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adds semantic tags to edges.
 *
 * <p>Network tags describe the direction of an edge relative to networking operators.
 * Collection tags describe the data flowing along an edge, derived from the return type of
 * the edge's source node. Tags are always appended to existing ones.
 */
public class EdgeTagger {

    private static final Logger log = LoggerFactory.getLogger(EdgeTagger.class);

    public static final String NETWORK = "network";
    public static final String NETWORK_SOURCE = "network-source";
    public static final String REMOTE_SENDER = "remote-sender";
    public static final String NETWORK_TARGET = "network-target";
    public static final String REMOTE_RECEIVER = "remote-receiver";
    public static final String NETWORK_TO_NETWORK = "network-to-network";
    public static final String KEYED = "Keyed";
    public static final String NOT_KEYED = "NotKeyed";

    private final OperatorRegistry registry;

    public EdgeTagger(OperatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Tags edges touching networking operators.
     *
     * <p>If only the source is a networking operator the edge gets {@code network},
     * {@code network-source} and {@code remote-sender}; if only the target is, it gets
     * {@code network}, {@code network-target} and {@code remote-receiver}; if both are, it gets
     * {@code network} and {@code network-to-network}. Edges with an unknown endpoint pass
     * through untouched.
     *
     * @param edges edges to tag
     * @param nodes graph nodes
     * @return tagged edges, in input order
     */
    public List<GraphEdge> tagNetworkEdges(List<GraphEdge> edges, List<GraphNode> nodes) {
        Map<NodeId, GraphNode> byId = index(nodes);
        List<GraphEdge> tagged = new ArrayList<>(edges.size());
        int networkEdges = 0;

        for (GraphEdge edge : edges) {
            GraphNode source = byId.get(edge.source());
            GraphNode target = byId.get(edge.target());
            if (source == null || target == null) {
                tagged.add(edge);
                continue;
            }

            boolean sourceIsNetwork = registry.isNetworkingOperator(source.shortLabel());
            boolean targetIsNetwork = registry.isNetworkingOperator(target.shortLabel());
            if (sourceIsNetwork && targetIsNetwork) {
                tagged.add(edge.withAddedTags(List.of(NETWORK, NETWORK_TO_NETWORK)));
                networkEdges++;
            } else if (sourceIsNetwork) {
                tagged.add(edge.withAddedTags(List.of(NETWORK, NETWORK_SOURCE, REMOTE_SENDER)));
                networkEdges++;
            } else if (targetIsNetwork) {
                tagged.add(edge.withAddedTags(List.of(NETWORK, NETWORK_TARGET, REMOTE_RECEIVER)));
                networkEdges++;
            } else {
                tagged.add(edge);
            }
        }

        log.debug("Tagged {} of {} edges as network edges", networkEdges, edges.size());
        return tagged;
    }

    /**
     * Tags edges with the shape of the collection produced by their source node:
     * {@code Stream}, {@code Singleton} or {@code Optional}, {@code Keyed} or {@code NotKeyed},
     * and the boundedness and ordering when the type declares them.
     *
     * @param edges edges to tag
     * @param nodes graph nodes
     * @return tagged edges, in input order
     */
    public List<GraphEdge> tagCollectionSemantics(List<GraphEdge> edges, List<GraphNode> nodes) {
        Map<NodeId, GraphNode> byId = index(nodes);
        List<GraphEdge> tagged = new ArrayList<>(edges.size());
        for (GraphEdge edge : edges) {
            GraphNode source = byId.get(edge.source());
            List<String> tags = source == null ? List.of() : collectionTags(source.data().returnType());
            tagged.add(tags.isEmpty() ? edge : edge.withAddedTags(tags));
        }
        return tagged;
    }

    private static List<String> collectionTags(String returnType) {
        Optional<String> collectionType = TypeParser.unwrapCollectionType(returnType);
        Optional<CollectionKind> kind = collectionType.flatMap(TypeParser::extractCollectionKind);
        if (kind.isEmpty()) {
            return List.of();
        }

        List<String> tags = new ArrayList<>();
        tags.add(kind.get().shapeTag());
        tags.add(kind.get().keyed() ? KEYED : NOT_KEYED);

        List<String> params = TypeParser.parseTypeParameters(collectionType.get());
        // Boundedness and ordering follow the location parameter.
        List<String> flags = params.size() > kind.get().locationParameterIndex()
            ? params.subList(kind.get().locationParameterIndex() + 1, params.size())
            : List.of();
        TypeParser.extractBoundedness(flags).map(Boundedness::tag).ifPresent(tags::add);
        TypeParser.extractOrdering(flags).map(Ordering::tag).ifPresent(tags::add);
        return tags;
    }

    private static Map<NodeId, GraphNode> index(List<GraphNode> nodes) {
        Map<NodeId, GraphNode> byId = new HashMap<>();
        for (GraphNode node : nodes) {
            byId.put(node.id(), node);
        }
        return byId;
    }
}

package com.dataflowscope.core.graph;

import com.dataflowscope.core.model.GraphEdge;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.NodeData;
import com.dataflowscope.core.model.NodeId;
import com.dataflowscope.core.model.NodeType;
import com.dataflowscope.core.operator.OperatorRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EdgeTagger}.
 */
class EdgeTaggerTest {

    private final EdgeTagger tagger = new EdgeTagger(OperatorRegistry.withDefaults());

    @Test
    void tagNetworkEdges_sourceIsNetwork_tagsRemoteSender() {
        List<GraphNode> nodes = List.of(node(0, "send_bincode", null), node(1, "map", null));

        List<GraphEdge> tagged = tagger.tagNetworkEdges(List.of(edge("0", 0, 1)), nodes);

        assertThat(tagged.get(0).semanticTags()).containsExactly("network", "network-source", "remote-sender");
    }

    @Test
    void tagNetworkEdges_targetIsNetwork_tagsRemoteReceiver() {
        List<GraphNode> nodes = List.of(node(0, "map", null), node(1, "send_bincode", null));

        List<GraphEdge> tagged = tagger.tagNetworkEdges(List.of(edge("0", 0, 1)), nodes);

        assertThat(tagged.get(0).semanticTags()).containsExactly("network", "network-target", "remote-receiver");
    }

    @Test
    void tagNetworkEdges_bothNetwork_tagsNetworkToNetwork() {
        List<GraphNode> nodes = List.of(node(0, "send_bincode", null), node(1, "recv_bincode", null));

        List<GraphEdge> tagged = tagger.tagNetworkEdges(List.of(edge("0", 0, 1)), nodes);

        assertThat(tagged.get(0).semanticTags()).containsExactly("network", "network-to-network");
    }

    @Test
    void tagNetworkEdges_localEdgeOrUnknownEndpoint_passesThrough() {
        List<GraphNode> nodes = List.of(node(0, "map", null), node(1, "filter", null));
        GraphEdge local = edge("0", 0, 1);
        GraphEdge dangling = edge("1", 1, 7);

        List<GraphEdge> tagged = tagger.tagNetworkEdges(List.of(local, dangling), nodes);

        assertThat(tagged).containsExactly(local, dangling);
    }

    @Test
    void tagNetworkEdges_appendsToExistingTags() {
        List<GraphNode> nodes = List.of(node(0, "send_bincode", null), node(1, "map", null));
        GraphEdge tagged = new GraphEdge("0", new NodeId(0), new NodeId(1), List.of("custom"));

        List<GraphEdge> result = tagger.tagNetworkEdges(List.of(tagged), nodes);

        assertThat(result.get(0).semanticTags()).startsWith("custom").contains("network");
    }

    @Test
    void tagCollectionSemantics_stream_tagsShapeBoundednessAndOrdering() {
        List<GraphNode> nodes = List.of(
            node(0, "map", "Stream<T, Process<'a, Leader>, Unbounded, TotalOrder>"),
            node(1, "filter", null));

        List<GraphEdge> tagged = tagger.tagCollectionSemantics(List.of(edge("0", 0, 1)), nodes);

        assertThat(tagged.get(0).semanticTags()).containsExactly("Stream", "NotKeyed", "Unbounded", "TotalOrder");
    }

    @Test
    void tagCollectionSemantics_keyedSingleton_tagsKeyed() {
        List<GraphNode> nodes = List.of(
            node(0, "fold_keyed", "KeyedSingleton<K, V, Tick<Process<'a, Leader>>, Bounded>"),
            node(1, "all_ticks", null));

        List<GraphEdge> tagged = tagger.tagCollectionSemantics(List.of(edge("0", 0, 1)), nodes);

        assertThat(tagged.get(0).semanticTags()).containsExactly("Singleton", "Keyed", "Bounded");
    }

    @Test
    void tagCollectionSemantics_nonCollectionSource_leavesEdge() {
        List<GraphNode> nodes = List.of(node(0, "for_each", "()"), node(1, "map", null));
        GraphEdge edge = edge("0", 0, 1);

        assertThat(tagger.tagCollectionSemantics(List.of(edge), nodes)).containsExactly(edge);
    }

    private static GraphNode node(int id, String name, String returnType) {
        NodeData data = NodeData.at(null).withLocation(null, null, null, returnType);
        return new GraphNode(new NodeId(id), NodeType.TRANSFORM, name, name, name, data);
    }

    private static GraphEdge edge(String id, int source, int target) {
        return GraphEdge.between(id, new NodeId(source), new NodeId(target));
    }
}

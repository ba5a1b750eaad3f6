package com.dataflowscope.core.pipeline;

import com.dataflowscope.core.PipelineFixtures;
import com.dataflowscope.core.config.ProjectConfig;
import com.dataflowscope.core.graph.FunctionResolver;
import com.dataflowscope.core.graph.GraphValidator;
import com.dataflowscope.core.hierarchy.HierarchyBuilder;
import com.dataflowscope.core.model.DataflowGraph;
import com.dataflowscope.core.model.ExtractionRequest;
import com.dataflowscope.core.model.GraphEdge;
import com.dataflowscope.core.model.GraphNode;
import com.dataflowscope.core.model.Hierarchy;
import com.dataflowscope.core.model.HierarchyContainer;
import com.dataflowscope.core.model.HierarchyData;
import com.dataflowscope.core.model.Legend;
import com.dataflowscope.core.model.NodeTypeConfig;
import com.dataflowscope.core.model.OperatorCall;
import com.dataflowscope.core.model.OperatorChain;
import com.dataflowscope.core.model.ScopeTarget;
import com.dataflowscope.core.model.SourceDocument;
import com.dataflowscope.core.model.SyntaxSnapshot;
import com.dataflowscope.core.model.VariableBinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link DataflowGraphExtractor}.
 */
class DataflowGraphExtractorTest {

    private DataflowGraphExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new DataflowGraphExtractor(ProjectConfig.defaults());
    }

    @Test
    void extract_wordCountPipeline_buildsCompleteGraph() {
        DataflowGraph graph = extractor.extract(PipelineFixtures.request());

        assertThat(graph.nodes()).hasSize(8);
        assertThat(graph.edges()).hasSize(6);
        assertThat(graph.selectedHierarchy()).isEqualTo("location");
        assertThat(graph.hierarchyChoices()).extracting(Hierarchy::id).containsExactly("location", "code");
        assertThat(graph.edgeStyleConfig()).isEqualTo(VisualizationMetadata.edgeStyleConfig());
        assertThat(graph.nodeTypeConfig()).isEqualTo(VisualizationMetadata.nodeTypeConfig());
        assertThat(graph.legend()).isEqualTo(VisualizationMetadata.legend());
        assertThat(new GraphValidator().validate(graph)).isEmpty();
    }

    @Test
    void extract_typedPipeline_sortsSemanticTags() {
        DataflowGraph graph = extractor.extract(PipelineFixtures.request());

        assertThat(graph.edges().get(0).semanticTags()).containsExactly("NotKeyed", "Stream", "TotalOrder", "Unbounded");
        assertThat(graph.edges().get(2).semanticTags()).containsExactly("Bounded", "NotKeyed", "Stream", "TotalOrder");
        assertThat(graph.edges().get(3).semanticTags()).containsExactly("Bounded", "Keyed", "Singleton");
    }

    @Test
    void extract_networkPipeline_tagsNetworkEdges() {
        SourceDocument document = SourceDocument.of("mem://net.rs", 1,
            "    let sent = numbers.map(q!(|x| x)).send_bincode(&workers).for_each(q!(|x| drop(x)));");
        VariableBinding sent = new VariableBinding("sent", 0, List.of(
            OperatorCall.at("map", 0, 23),
            OperatorCall.at("send_bincode", 0, 38),
            OperatorCall.at("for_each", 0, 61)));
        ExtractionRequest request = new ExtractionRequest(document, ScopeTarget.file(),
            new SyntaxSnapshot(List.of(sent), List.of(), List.of()), List.of());

        DataflowGraph graph = extractor.extract(request);

        assertThat(graph.edges()).extracting(GraphEdge::semanticTags).containsExactly(
            List.of("network", "network-target", "remote-receiver"),
            List.of("network", "network-source", "remote-sender"));
    }

    @Test
    void extract_withoutTypes_degradesToUnknownLocation() {
        ExtractionRequest request = new ExtractionRequest(PipelineFixtures.document(), ScopeTarget.file(),
            PipelineFixtures.snapshot(), List.of());

        DataflowGraph graph = extractor.extract(request);

        assertThat(graph.nodes()).hasSize(8);
        Hierarchy location = graph.hierarchyChoices().get(0);
        assertThat(location.children()).singleElement()
            .satisfies(container -> assertThat(container.name()).isEqualTo("(unknown location)"));
        assertThat(graph.edges()).allSatisfy(edge -> assertThat(edge.semanticTags()).isEmpty());
    }

    @Test
    void extract_functionScope_keepsSelectedFunctionOnly() {
        ExtractionRequest request = new ExtractionRequest(PipelineFixtures.document(),
            ScopeTarget.functions(List.of("helper")), PipelineFixtures.snapshot(), PipelineFixtures.annotations());

        DataflowGraph graph = extractor.extract(request);

        assertThat(graph.nodes()).extracting(GraphNode::shortLabel).containsExactly("source_iter", "inspect");
        assertThat(graph.edges()).hasSize(1);
        HierarchyContainer file = graph.hierarchyChoices().get(1).children().get(0);
        assertThat(file.children()).extracting(HierarchyContainer::name).containsExactly("fn helper");
    }

    @Test
    void extract_differentFunctionScopes_cachesEachScopeSeparately() {
        ExtractionRequest helperOnly = new ExtractionRequest(PipelineFixtures.document(),
            ScopeTarget.functions(List.of("helper")), PipelineFixtures.snapshot(), PipelineFixtures.annotations());
        ExtractionRequest pipelineOnly = new ExtractionRequest(PipelineFixtures.document(),
            ScopeTarget.functions(List.of("pipeline")), PipelineFixtures.snapshot(), PipelineFixtures.annotations());

        DataflowGraph helper = extractor.extract(helperOnly);
        DataflowGraph pipeline = extractor.extract(pipelineOnly);

        assertThat(helper.nodes()).extracting(GraphNode::shortLabel).containsExactly("source_iter", "inspect");
        assertThat(pipeline.nodes()).extracting(GraphNode::shortLabel)
            .contains("fold_keyed", "for_each")
            .doesNotContain("inspect");
        assertThat(extractor.cacheStats().hits()).isZero();
        assertThat(extractor.cacheStats().entries()).isEqualTo(2);
    }

    @Test
    void extract_reorderedFunctionScope_servesFromCache() {
        ExtractionRequest first = new ExtractionRequest(PipelineFixtures.document(),
            ScopeTarget.functions(List.of("pipeline", "helper")), PipelineFixtures.snapshot(),
            PipelineFixtures.annotations());
        ExtractionRequest reordered = new ExtractionRequest(PipelineFixtures.document(),
            ScopeTarget.functions(List.of("helper", "pipeline", "helper")), PipelineFixtures.snapshot(),
            PipelineFixtures.annotations());

        DataflowGraph graph = extractor.extract(first);

        assertThat(extractor.extract(reordered)).isSameAs(graph);
        assertThat(extractor.cacheStats().hits()).isEqualTo(1);
    }

    @Test
    void extract_sameDocumentVersion_servesFromCache() {
        DataflowGraph first = extractor.extract(PipelineFixtures.request());
        DataflowGraph second = extractor.extract(PipelineFixtures.request());

        assertThat(second).isSameAs(first);
        assertThat(extractor.cacheStats().hits()).isEqualTo(1);
        assertThat(extractor.cacheStats().misses()).isEqualTo(1);
        assertThat(extractor.cacheStats().entries()).isEqualTo(1);
    }

    @Test
    void extract_newDocumentVersion_rebuilds() {
        DataflowGraph first = extractor.extract(PipelineFixtures.request());
        ExtractionRequest edited = new ExtractionRequest(PipelineFixtures.document(2), ScopeTarget.file(),
            PipelineFixtures.snapshot(), PipelineFixtures.annotations());

        DataflowGraph second = extractor.extract(edited);

        assertThat(second).isNotSameAs(first).isEqualTo(first);
        assertThat(extractor.cacheStats().entries()).isEqualTo(2);
    }

    @Test
    void clearCache_forcesRebuild() {
        DataflowGraph first = extractor.extract(PipelineFixtures.request());

        extractor.clearCache();

        assertThat(extractor.extract(PipelineFixtures.request())).isNotSameAs(first);
        assertThat(extractor.cacheStats().hits()).isZero();
    }

    @Test
    void clearCache_singleKey_removesEntry() {
        extractor.extract(PipelineFixtures.request());

        extractor.clearCache(PipelineFixtures.URI + "::v1::file");

        assertThat(extractor.cacheStats().entries()).isZero();
    }

    @Test
    void extract_internalFailure_returnsEmptyGraphWithoutCaching() {
        HierarchyBuilder failing = new HierarchyBuilder() {
            @Override
            public HierarchyData build(SourceDocument document, List<GraphNode> nodes, List<VariableBinding> bindings,
                                       List<OperatorChain> standaloneChains, FunctionResolver functions) {
                throw new IllegalStateException("boom");
            }
        };
        DataflowGraphExtractor fragile = new DataflowGraphExtractor(ProjectConfig.defaults(), failing);

        DataflowGraph graph = fragile.extract(PipelineFixtures.request());

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.hierarchyChoices()).extracting(Hierarchy::id).containsExactly("location", "code");
        assertThat(graph.hierarchyChoices().get(0).children())
            .extracting(HierarchyContainer::id, HierarchyContainer::name)
            .containsExactly(tuple("loc_0", "(default)"));
        assertThat(graph.hierarchyChoices().get(1).children().get(0).name()).isEqualTo("word_count.rs");
        assertThat(fragile.cacheStats().entries()).isZero();
    }

    @Test
    void visualizationMetadata_listsNodeTypesAlphabetically() {
        NodeTypeConfig nodeTypes = VisualizationMetadata.nodeTypeConfig();
        Legend legend = VisualizationMetadata.legend();

        assertThat(nodeTypes.defaultType()).isEqualTo("Transform");
        assertThat(nodeTypes.types()).extracting(NodeTypeConfig.TypeStyle::id)
            .containsExactly("Aggregation", "Join", "Network", "Sink", "Source", "Tee", "Transform");
        assertThat(nodeTypes.types()).extracting(NodeTypeConfig.TypeStyle::colorIndex)
            .containsExactly(0, 1, 2, 3, 4, 5, 6);
        assertThat(legend.title()).isEqualTo("Node Types");
        assertThat(legend.items()).hasSize(7);
        assertThat(VisualizationMetadata.edgeStyleConfig().semanticMappings())
            .containsOnlyKeys("BoundednessGroup", "CollectionGroup", "KeyednessGroup", "NetworkGroup", "OrderingGroup");
        assertThat(VisualizationMetadata.edgeStyleConfig().semanticPriorities()).hasSize(4);
    }
}

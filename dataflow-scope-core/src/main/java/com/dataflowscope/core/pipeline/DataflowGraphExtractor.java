package com.dataflowscope.core.pipeline;

import com.dataflowscope.core.cache.CacheKey;
import com.dataflowscope.core.cache.CacheStats;
import com.dataflowscope.core.cache.ExtractionCache;
import com.dataflowscope.core.config.ProjectConfig;
import com.dataflowscope.core.graph.EdgeTagger;
import com.dataflowscope.core.graph.FullLabelExtractor;
import com.dataflowscope.core.graph.FunctionResolver;
import com.dataflowscope.core.graph.GraphAssembler;
import com.dataflowscope.core.graph.GraphValidator;
import com.dataflowscope.core.graph.TypeAnnotationIndex;
import com.dataflowscope.core.hierarchy.CodeHierarchyBuilder;
import com.dataflowscope.core.hierarchy.HierarchyBuilder;
import com.dataflowscope.core.hierarchy.LocationHierarchyBuilder;
import com.dataflowscope.core.model.DataflowGraph;
import com.dataflowscope.core.model.ExtractionRequest;
import com.dataflowscope.core.model.GraphBuildResult;
import com.dataflowscope.core.model.GraphEdge;
import com.dataflowscope.core.model.Hierarchy;
import com.dataflowscope.core.model.HierarchyContainer;
import com.dataflowscope.core.model.HierarchyData;
import com.dataflowscope.core.model.OperatorChain;
import com.dataflowscope.core.model.ScopeTarget;
import com.dataflowscope.core.model.ScopeType;
import com.dataflowscope.core.model.SyntaxSnapshot;
import com.dataflowscope.core.model.VariableBinding;
import com.dataflowscope.core.operator.OperatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs the full extraction pipeline for one document.
 *
 * <p>Steps: cache lookup, scope filtering, graph assembly with type matching, edge tagging,
 * hierarchy building, output assembly, validation and cache store. The extractor never
 * throws for bad input: validation problems are logged as warnings, and an unexpected
 * failure yields an empty, well-formed graph that is not cached.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DataflowGraphExtractor extractor = new DataflowGraphExtractor(ConfigLoader.load(configPath));
 * DataflowGraph graph = extractor.extract(request);
 * }</pre>
 *
 * <p>Instances are safe for concurrent use: passes share nothing but the cache.
 */
public class DataflowGraphExtractor {

    private static final Logger log = LoggerFactory.getLogger(DataflowGraphExtractor.class);

    private final ProjectConfig config;
    private final OperatorRegistry registry;
    private final GraphAssembler assembler;
    private final EdgeTagger edgeTagger;
    private final HierarchyBuilder hierarchyBuilder;
    private final GraphValidator validator;
    private final ExtractionCache<DataflowGraph> cache;

    public DataflowGraphExtractor() {
        this(ProjectConfig.defaults());
    }

    /**
     * Creates an extractor from configuration.
     *
     * @param config project configuration
     */
    public DataflowGraphExtractor(ProjectConfig config) {
        this(config, new HierarchyBuilder());
    }

    DataflowGraphExtractor(ProjectConfig config, HierarchyBuilder hierarchyBuilder) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = new OperatorRegistry(config.operators());
        this.assembler = new GraphAssembler(registry, new FullLabelExtractor(config.analysis().maxLabelLength()));
        this.edgeTagger = new EdgeTagger(registry);
        this.hierarchyBuilder = Objects.requireNonNull(hierarchyBuilder, "hierarchyBuilder must not be null");
        this.validator = new GraphValidator();
        this.cache = new ExtractionCache<>(config.cache().maxSize());
    }

    /**
     * Extracts the dataflow graph of a document.
     *
     * @param request document, scope, syntax records and type annotations
     * @return graph, possibly served from the cache
     */
    public DataflowGraph extract(ExtractionRequest request) {
        String cacheKey = CacheKey.of(request.document(), request.scope()).value();
        var cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", cacheKey);
            return cached.get();
        }

        log.info("Extracting graph for {} (scope: {})", request.document().fileName(), request.scope().type().keySegment());
        try {
            DataflowGraph graph = runPipeline(request);
            cache.set(cacheKey, graph, Map.<String, Object>of("nodes", graph.nodes().size(), "edges", graph.edges().size()));
            return graph;
        } catch (RuntimeException e) {
            log.error("Graph extraction failed for {}: {}", request.document().uri(), e.getMessage(), e);
            return emptyGraph(request);
        }
    }

    /**
     * Removes one cached graph.
     *
     * @param cacheKey rendered {@link CacheKey}
     */
    public void clearCache(String cacheKey) {
        cache.clear(cacheKey);
    }

    /**
     * Removes every cached graph and resets cache statistics.
     */
    public void clearCache() {
        cache.clear();
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public OperatorRegistry registry() {
        return registry;
    }

    private DataflowGraph runPipeline(ExtractionRequest request) {
        SyntaxSnapshot syntax = request.syntax();
        FunctionResolver functions = FunctionResolver.fromSpans(syntax.functions());
        SyntaxSnapshot scoped = applyScope(syntax, request.scope(), functions);

        TypeAnnotationIndex typeIndex = new TypeAnnotationIndex(
            request.typeAnnotations(), config.analysis().typeMatchTolerance());
        if (typeIndex.isEmpty()) {
            log.warn("DEGRADED MODE: no type information for {}, building graph from syntax only",
                request.document().fileName());
        }

        GraphBuildResult built = assembler.build(
            request.document(), scoped.bindings(), scoped.standaloneChains(), functions, typeIndex);

        List<GraphEdge> edges = edgeTagger.tagNetworkEdges(built.edges(), built.nodes());
        edges = edgeTagger.tagCollectionSemantics(edges, built.nodes());

        HierarchyData hierarchies = hierarchyBuilder.build(
            request.document(), built.nodes(), scoped.bindings(), scoped.standaloneChains(), functions);

        DataflowGraph graph = assemble(built, sortTags(edges), hierarchies);

        List<String> issues = validator.validate(graph);
        if (!issues.isEmpty()) {
            log.warn("Graph for {} has {} validation issue(s)", request.document().fileName(), issues.size());
            issues.forEach(issue -> log.warn("  - {}", issue));
        }

        log.info("Extracted {} nodes and {} edges from {}",
            graph.nodes().size(), graph.edges().size(), request.document().fileName());
        return graph;
    }

    private SyntaxSnapshot applyScope(SyntaxSnapshot syntax, ScopeTarget scope, FunctionResolver functions) {
        if (scope.type() != ScopeType.FUNCTION || scope.functions().isEmpty()) {
            return syntax;
        }

        Set<String> selected = Set.copyOf(scope.functions());
        List<VariableBinding> bindings = syntax.bindings().stream()
            .filter(binding -> functions.enclosingFunction(binding.declarationLine())
                .map(selected::contains).orElse(false))
            .toList();
        List<OperatorChain> chains = syntax.standaloneChains().stream()
            .filter(chain -> !chain.operators().isEmpty())
            .filter(chain -> functions.enclosingFunction(chain.operators().get(0).line())
                .map(selected::contains).orElse(false))
            .toList();

        log.debug("Function scope {} keeps {} of {} variable chains and {} of {} standalone chains",
            selected, bindings.size(), syntax.bindings().size(), chains.size(), syntax.standaloneChains().size());
        return new SyntaxSnapshot(bindings, chains, syntax.functions());
    }

    private static DataflowGraph emptyGraph(ExtractionRequest request) {
        Hierarchy location = new Hierarchy(LocationHierarchyBuilder.HIERARCHY_ID, LocationHierarchyBuilder.HIERARCHY_NAME,
            List.of(new HierarchyContainer("loc_0", LocationHierarchyBuilder.DEFAULT_CONTAINER, List.of())));
        Hierarchy code = new Hierarchy(CodeHierarchyBuilder.HIERARCHY_ID, CodeHierarchyBuilder.HIERARCHY_NAME,
            List.of(new HierarchyContainer("code_0", request.document().baseName(), List.of())));

        Map<String, Map<String, String>> assignments = new LinkedHashMap<>();
        assignments.put(location.id(), Map.of());
        assignments.put(code.id(), Map.of());
        return assemble(GraphBuildResult.empty(), List.of(),
            new HierarchyData(List.of(location, code), assignments, location.id()));
    }

    private static DataflowGraph assemble(GraphBuildResult built, List<GraphEdge> edges, HierarchyData hierarchies) {
        return new DataflowGraph(
            built.nodes(),
            edges,
            hierarchies.hierarchyChoices(),
            hierarchies.nodeAssignments(),
            hierarchies.selectedHierarchy(),
            VisualizationMetadata.edgeStyleConfig(),
            VisualizationMetadata.nodeTypeConfig(),
            VisualizationMetadata.legend()
        );
    }

    private static List<GraphEdge> sortTags(List<GraphEdge> edges) {
        return edges.stream()
            .map(edge -> edge.withTags(List.copyOf(new TreeSet<>(edge.semanticTags()))))
            .toList();
    }
}

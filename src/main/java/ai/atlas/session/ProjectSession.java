package ai.atlas.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.graph.BuildResult;
import ai.atlas.graph.CodeGraph;
import ai.atlas.graph.DependencyGraphBuilder;
import ai.atlas.graph.GraphEdge;
import ai.atlas.graph.GraphSnapshot;
import ai.atlas.graph.ScopeGraphBuilder;
import ai.atlas.graph.StructureGraphBuilder;
import ai.atlas.io.AtlasConfig;
import ai.atlas.io.GraphStore;
import ai.atlas.io.ScopeSet;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.GraphKind;
import ai.atlas.model.Ids;
import ai.atlas.model.Tier;
import ai.atlas.render.RenderPlan;
import ai.atlas.render.RenderStrategySelector;
import ai.atlas.render.StaticRasterGenerator;
import ai.atlas.scan.ParseStage;
import ai.atlas.scan.PolyglotParser;
import ai.atlas.scan.ProgressListener;
import ai.atlas.scan.ProjectWalker;
import ai.atlas.scan.SourceParser;

/**
 * Everything bound to one open project: root, configuration, artifact store,
 * scope set, builders and the graph most recently loaded for display.
 */
public final class ProjectSession {

    private static final Logger log = LoggerFactory.getLogger(ProjectSession.class);

    public static final String GRAPHS_DIR = "graphs";
    public static final String OUTPUTS_DIR = "outputs";

    static final int SEARCH_LIMIT = 50;
    static final int BROWSE_LIMIT = 100;

    private final Path root;
    private final Path dataDir;
    private final AtlasConfig config;
    private final GraphStore store;
    private final ScopeSet scope;
    private final ProjectWalker walker;

    private final StructureGraphBuilder structureBuilder;
    private final DependencyGraphBuilder dependencyBuilder;
    private final ScopeGraphBuilder scopeBuilder;
    private final RenderStrategySelector selector;

    private GraphKind currentKind;
    private GraphSnapshot current;

    public ProjectSession(Path root, Path dataDir, AtlasConfig config, SourceParser parser) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        this.dataDir = dataDir == null
                ? this.root.resolve(AtlasConfig.DATA_DIR_NAME)
                : dataDir.toAbsolutePath().normalize();
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(parser, "parser");

        this.store = new GraphStore(this.dataDir.resolve(GRAPHS_DIR));
        this.scope = new ScopeSet(this.dataDir.resolve(OUTPUTS_DIR).resolve(ScopeSet.FILE_NAME));

        final Set<String> extraIgnored = new LinkedHashSet<>();
        extraIgnored.add(AtlasConfig.DATA_DIR_NAME);
        if (this.dataDir.getFileName() != null) {
            extraIgnored.add(this.dataDir.getFileName().toString());
        }
        this.walker = new ProjectWalker(this.root, extraIgnored);

        final StaticRasterGenerator raster = new StaticRasterGenerator(config.rasterCanvasSize(), config.rasterLabels());
        this.structureBuilder = new StructureGraphBuilder(store, raster, config);
        this.dependencyBuilder = new DependencyGraphBuilder(store, structureBuilder,
                new ParseStage(parser, config.workers(), config.progressInterval()), raster, config);
        this.scopeBuilder = new ScopeGraphBuilder(store, parser, raster);
        this.selector = new RenderStrategySelector(config.interactiveCeiling(), config.initialLoadSize());
    }

    /** Session with the default multi-language parser. */
    public static ProjectSession open(Path root, Path dataDir, AtlasConfig config) {
        return new ProjectSession(root, dataDir, config, new PolyglotParser());
    }

    public Path root() {
        return root;
    }

    public Path dataDir() {
        return dataDir;
    }

    public AtlasConfig config() {
        return config;
    }

    public GraphStore store() {
        return store;
    }

    public ScopeSet scope() {
        return scope;
    }

    // --- builds ---

    public BuildResult buildStructure(ProgressListener listener) throws IOException {
        log.info("Building structure graph for {}", root);
        return structureBuilder.build(walker, listener);
    }

    public BuildResult buildDependencies(ProgressListener listener) throws IOException, InterruptedException {
        log.info("Building dependency graph for {}", root);
        return dependencyBuilder.build(walker, listener);
    }

    public BuildResult buildScope(ProgressListener listener) throws IOException {
        final List<String> files = scope.list();
        log.info("Building scope graph over {} file(s)", files.size());
        return scopeBuilder.build(root, files, listener);
    }

    // --- display ---

    /**
     * Loads the persisted tier of {@code kind}, makes it the current graph and
     * decides how it should be presented.
     */
    public RenderPlan loadGraph(GraphKind kind, boolean fullDetail) {
        Objects.requireNonNull(kind, "kind");
        final GraphSnapshot snapshot = store.load(kind.artifactName(Tier.of(fullDetail)));
        final RenderPlan plan = selector.select(kind, fullDetail, snapshot);
        this.currentKind = kind;
        this.current = plan.snapshot();
        log.debug("Loaded {} ({} nodes) as {}", snapshot.name(), plan.nodeCount(), plan.mode());
        return plan;
    }

    public Optional<GraphSnapshot> current() {
        return Optional.ofNullable(current);
    }

    public Optional<GraphKind> currentKind() {
        return Optional.ofNullable(currentKind);
    }

    /** Removes every artifact, raster and the scope file; forgets the current graph. */
    public void clearCache() throws IOException {
        store.clear();
        Files.deleteIfExists(scope.file());
        current = null;
        currentKind = null;
        log.info("Cache cleared for {}", root);
    }

    // --- queries ---

    /**
     * The file followed by the files it imports and the files importing it.
     * Uses the current graph when it is a dependency graph, else the persisted
     * full dependency graph. Empty when no dependency graph exists or the file
     * is not one of its nodes.
     */
    public List<String> extrapolateDependencies(String file) {
        final String id = Ids.normalizePath(file);
        final CodeGraph graph = currentKind == GraphKind.DEPENDENCY && current != null
                ? current.graph()
                : store.load(GraphKind.DEPENDENCY.artifactName(Tier.FULL)).graph();

        if (!graph.hasNode(id)) {
            log.warn("Cannot extrapolate {}: not in the dependency graph", id);
            return List.of();
        }
        final Set<String> related = new LinkedHashSet<>();
        related.add(id);
        for (GraphEdge e : graph.inEdges(id)) {
            if (e.kind() == EdgeKind.INCLUDE) {
                related.add(e.source());
            }
        }
        for (GraphEdge e : graph.outEdges(id)) {
            if (e.kind() == EdgeKind.INCLUDE) {
                related.add(e.target());
            }
        }
        return new ArrayList<>(related);
    }

    /**
     * Source files whose path contains {@code query} (case-insensitive), shortest
     * first. A blank query lists the first files of the project.
     */
    public List<String> searchFiles(String query) throws IOException {
        final List<String> files = walker.sourceFiles();
        final String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (q.isEmpty()) {
            return new ArrayList<>(files.subList(0, Math.min(BROWSE_LIMIT, files.size())));
        }
        final List<String> hits = new ArrayList<>();
        for (String f : files) {
            if (f.toLowerCase(Locale.ROOT).contains(q)) {
                hits.add(f);
            }
        }
        hits.sort(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()));
        return hits.size() > SEARCH_LIMIT ? new ArrayList<>(hits.subList(0, SEARCH_LIMIT)) : hits;
    }
}

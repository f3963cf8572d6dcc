package ai.atlas.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.io.AtlasConfig;
import ai.atlas.io.GraphStore;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.GraphKind;
import ai.atlas.model.NodeKind;
import ai.atlas.model.ParsedFile;
import ai.atlas.model.Tier;
import ai.atlas.render.StaticRasterGenerator;
import ai.atlas.scan.ParseStage;
import ai.atlas.scan.ProgressListener;
import ai.atlas.scan.ProjectWalker;
import ai.atlas.scan.SourceLanguage;

/**
 * File-to-file import graph. Reuses the structure graph's nodes and layout,
 * drops its containment edges and adds one {@code include} edge per resolved
 * import. The structure graph is built first if it has never been persisted.
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final GraphStore store;
    private final StructureGraphBuilder structureBuilder;
    private final ParseStage parseStage;
    private final StaticRasterGenerator raster;
    private final AtlasConfig config;

    public DependencyGraphBuilder(GraphStore store,
                                  StructureGraphBuilder structureBuilder,
                                  ParseStage parseStage,
                                  StaticRasterGenerator raster,
                                  AtlasConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.structureBuilder = Objects.requireNonNull(structureBuilder, "structureBuilder");
        this.parseStage = Objects.requireNonNull(parseStage, "parseStage");
        this.raster = Objects.requireNonNull(raster, "raster");
        this.config = Objects.requireNonNull(config, "config");
    }

    public BuildResult build(ProjectWalker walker, ProgressListener listener) throws IOException, InterruptedException {
        Objects.requireNonNull(walker, "walker");
        final ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        GraphSnapshot structureFull = store.load(GraphKind.STRUCTURE.artifactName(Tier.FULL));
        GraphSnapshot structureSimple = store.load(GraphKind.STRUCTURE.artifactName(Tier.SIMPLE));
        if (structureFull.graph().isEmpty()) {
            log.info("No structure graph yet, building it first");
            final BuildResult built = structureBuilder.build(walker, progress);
            structureFull = built.full();
            structureSimple = built.simple();
        }

        // universe: file nodes of the structure snapshot, not a fresh walk
        final List<String> universe = new ArrayList<>();
        final List<String> sources = new ArrayList<>();
        for (GraphNode n : structureFull.graph().nodes()) {
            if (n.kind() == NodeKind.FILE) {
                universe.add(n.id());
                if (SourceLanguage.isSourceFile(n.id())) {
                    sources.add(n.id());
                }
            }
        }

        log.info("Parsing imports of {} source files with {} workers", sources.size(), config.workers());
        final Map<String, ParsedFile> parsed = parseStage.run(walker.root(), sources, progress);

        final CodeGraph graph = structureFull.graph().copy();
        graph.removeAllEdges();
        final int edges = link(graph, parsed, new ImportResolver(universe));
        GraphStyler.applyVisualStyles(graph);
        log.info("Resolved {} include edges across {} files", edges, parsed.size());

        final String fullName = GraphKind.DEPENDENCY.artifactName(Tier.FULL);
        String staticImage = null;
        if (graph.nodeCount() > config.staticRenderThreshold()) {
            // inherited layout keeps the picture consistent with the structure raster
            log.info("Dependency graph has {} nodes, rendering static image", graph.nodeCount());
            final Optional<Path> image = raster.generate(graph, structureFull.positions(), fullName,
                    store.rasterPath(fullName));
            staticImage = image.map(Path::toString).orElse(null);
        }
        final GraphSnapshot full = new GraphSnapshot(fullName, graph, structureFull.positions(), parsed, staticImage);
        store.save(full);

        final CodeGraph simpleGraph = graph.induced(structureSimple.graph().nodeIds());
        final Map<String, ParsedFile> simpleMeta = new TreeMap<>();
        for (Map.Entry<String, ParsedFile> e : parsed.entrySet()) {
            if (simpleGraph.hasNode(e.getKey())) {
                simpleMeta.put(e.getKey(), e.getValue());
            }
        }
        final GraphSnapshot simple = new GraphSnapshot(GraphKind.DEPENDENCY.artifactName(Tier.SIMPLE),
                simpleGraph, structureSimple.positions(), simpleMeta, null);
        store.save(simple);

        progress.onProgress(parsed.size(), parsed.size(), "Dependency mapping complete.");
        return new BuildResult(full, simple);
    }

    /**
     * Adds an include edge for every import that resolves to another file of the
     * graph. Files whose parse failed contribute nothing.
     *
     * @return number of distinct edges in the graph afterwards
     */
    static int link(CodeGraph graph, Map<String, ParsedFile> parsed, ImportResolver resolver) {
        for (ParsedFile file : parsed.values()) {
            if (file.failed() || !graph.hasNode(file.path())) {
                continue;
            }
            for (String raw : file.imports()) {
                final Optional<String> target = resolver.resolve(file.path(), raw);
                if (target.isPresent() && !target.get().equals(file.path()) && graph.hasNode(target.get())) {
                    graph.addEdge(new GraphEdge(file.path(), target.get(), EdgeKind.INCLUDE));
                }
            }
        }
        return graph.edgeCount();
    }
}

package ai.atlas.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.io.AtlasConfig;
import ai.atlas.io.GraphStore;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.GraphKind;
import ai.atlas.model.Ids;
import ai.atlas.model.NodeKind;
import ai.atlas.model.Position;
import ai.atlas.model.Tier;
import ai.atlas.render.StaticRasterGenerator;
import ai.atlas.scan.ProgressListener;
import ai.atlas.scan.ProjectWalker;

/**
 * Directory / file containment graph of a project.
 *
 * Build steps:
 * 1) walk the tree once (ignore-set applied by the walker), one node per entry,
 *    {@code contains} edge from each directory to its immediate children
 * 2) group / size annotation
 * 3) seeded spring layout over the full graph
 * 4) persist full tier with layout; raster it when above the static threshold
 * 5) persist the simple tier: top nodes by degree, induced edges, no layout
 */
public final class StructureGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(StructureGraphBuilder.class);

    static final double LAYOUT_K_FACTOR = 0.8;

    private final GraphStore store;
    private final StaticRasterGenerator raster;
    private final AtlasConfig config;

    public StructureGraphBuilder(GraphStore store, StaticRasterGenerator raster, AtlasConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.raster = Objects.requireNonNull(raster, "raster");
        this.config = Objects.requireNonNull(config, "config");
    }

    public BuildResult build(ProjectWalker walker, ProgressListener listener) throws IOException {
        Objects.requireNonNull(walker, "walker");
        final ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        final CodeGraph graph = scan(walker);
        final int count = graph.nodeCount() - 1;
        progress.onProgress(count, count, "File Scan Complete. Found " + count + " items.");

        GraphStyler.applyVisualStyles(graph);

        log.info("Calculating layout for {} structure nodes", graph.nodeCount());
        final Map<String, Position> positions =
                new SpringLayout(LAYOUT_K_FACTOR, config.layoutIterations(), SpringLayout.DEFAULT_SEED).compute(graph);

        final String fullName = GraphKind.STRUCTURE.artifactName(Tier.FULL);
        String staticImage = null;
        if (graph.nodeCount() > config.staticRenderThreshold()) {
            log.info("Structure graph has {} nodes, rendering static image", graph.nodeCount());
            staticImage = raster.generate(graph, positions, fullName, store.rasterPath(fullName))
                    .map(Path::toString)
                    .orElse(null);
        }
        final GraphSnapshot full = new GraphSnapshot(fullName, graph, positions, Map.of(), staticImage);
        store.save(full);

        final GraphSnapshot simple = GraphSnapshot.of(
                GraphKind.STRUCTURE.artifactName(Tier.SIMPLE),
                graph.topByDegree(config.simpleNodeLimit()));
        store.save(simple);

        log.info("Structure graph saved: {} nodes / {} edges (simple: {} nodes)",
                graph.nodeCount(), graph.edgeCount(), simple.graph().nodeCount());
        return new BuildResult(full, simple);
    }

    CodeGraph scan(ProjectWalker walker) throws IOException {
        final CodeGraph graph = CodeGraph.empty();
        final String rootId = rootId(walker.root());
        graph.addNode(new GraphNode(rootId, NodeKind.DIRECTORY, rootId));

        for (ProjectWalker.Entry e : walker.entries()) {
            if (e.path().equals(rootId)) {
                log.warn("Entry {} shadows the root node, skipped", e.path());
                continue;
            }
            final NodeKind kind = e.directory() ? NodeKind.DIRECTORY : NodeKind.FILE;
            graph.addNode(new GraphNode(e.path(), kind, Ids.basename(e.path())));

            final String parent = Ids.parentDir(e.path());
            final String parentId = parent.isEmpty() ? rootId : parent;
            if (graph.hasNode(parentId)) {
                graph.addEdge(new GraphEdge(parentId, e.path(), EdgeKind.CONTAINS));
            }
        }
        return graph;
    }

    /** The root directory node is named after the project folder. */
    public static String rootId(Path projectRoot) {
        final Path name = projectRoot.toAbsolutePath().normalize().getFileName();
        return name == null ? "/" : name.toString();
    }
}

package ai.atlas.io;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.atlas.graph.CodeGraph;
import ai.atlas.graph.EdgeStyle;
import ai.atlas.graph.GraphEdge;
import ai.atlas.graph.GraphNode;
import ai.atlas.graph.GraphSnapshot;
import ai.atlas.model.EdgeLine;
import ai.atlas.model.NodeLine;
import ai.atlas.model.ParsedFile;
import ai.atlas.model.Position;

/**
 * One JSON document per graph artifact under the graphs directory, plus the
 * {@code static_<name>.png} rasters that sit next to them. Every save rewrites
 * the whole document; a missing or unreadable document loads as an empty graph.
 */
public final class GraphStore {

    private static final Logger log = LoggerFactory.getLogger(GraphStore.class);

    public static final String SCHEMA_VERSION = "code-atlas/v1";
    public static final String ARTIFACT_SUFFIX = ".json";
    public static final String RASTER_PREFIX = "static_";
    public static final String RASTER_SUFFIX = ".png";

    private final Path graphsDir;
    private final ObjectMapper jsonMapper;

    public GraphStore(Path graphsDir) {
        this.graphsDir = Objects.requireNonNull(graphsDir, "graphsDir");
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public Path graphsDir() {
        return graphsDir;
    }

    public Path artifactPath(String name) {
        return graphsDir.resolve(name + ARTIFACT_SUFFIX);
    }

    /** Deterministic raster location for a graph name. */
    public Path rasterPath(String name) {
        return graphsDir.resolve(RASTER_PREFIX + name + RASTER_SUFFIX);
    }

    public boolean exists(String name) {
        return Files.isRegularFile(artifactPath(name));
    }

    public void save(GraphSnapshot snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Files.createDirectories(graphsDir);

        final CodeGraph graph = snapshot.graph();
        final List<NodeLine> nodes = new ArrayList<>(graph.nodeCount());
        for (GraphNode n : graph.nodes()) {
            nodes.add(new NodeLine(n.id(), n.kind(), n.label(), n.group(), n.size(), n.title(),
                    n.attrs().isEmpty() ? null : new LinkedHashMap<>(n.attrs())));
        }
        final List<EdgeLine> edges = new ArrayList<>(graph.edgeCount());
        for (GraphEdge e : graph.edges()) {
            edges.add(new EdgeLine(e.source(), e.target(), e.kind(),
                    e.style().color(), e.style().dashed(), e.style().width()));
        }
        final Map<String, double[]> positions = new LinkedHashMap<>();
        for (Map.Entry<String, Position> p : snapshot.positions().entrySet()) {
            positions.put(p.getKey(), new double[]{p.getValue().x(), p.getValue().y()});
        }

        final Artifact doc = new Artifact(
                SCHEMA_VERSION,
                snapshot.name(),
                Instant.now().toString(),
                nodes,
                edges,
                positions,
                new TreeMap<>(snapshot.metadata()),
                snapshot.staticImagePath());
        jsonMapper.writeValue(artifactPath(snapshot.name()).toFile(), doc);
        log.debug("Saved {} ({} nodes, {} edges)", snapshot.name(), graph.nodeCount(), graph.edgeCount());
    }

    /** Never throws: absent or corrupt artifacts come back as {@link GraphSnapshot#empty(String)}. */
    public GraphSnapshot load(String name) {
        final Path file = artifactPath(name);
        if (!Files.isRegularFile(file)) {
            log.debug("No artifact for {} at {}", name, file);
            return GraphSnapshot.empty(name);
        }
        try {
            final Artifact doc = jsonMapper.readValue(file.toFile(), Artifact.class);
            return toSnapshot(name, doc);
        } catch (IOException | RuntimeException ex) {
            log.warn("Unreadable graph artifact {}, treating it as empty: {}", file, ex.getMessage());
            return GraphSnapshot.empty(name);
        }
    }

    /** Path of the raster for {@code name}, if one has been written. */
    public Optional<Path> staticImage(String name) {
        final Path p = rasterPath(name);
        return Files.isRegularFile(p) ? Optional.of(p) : Optional.empty();
    }

    /**
     * Deletes every artifact and raster in the graphs directory.
     *
     * @return number of files removed
     */
    public int clear() throws IOException {
        if (!Files.isDirectory(graphsDir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(graphsDir)) {
            for (Path p : ds) {
                final String fileName = p.getFileName().toString();
                if (fileName.endsWith(ARTIFACT_SUFFIX) || fileName.endsWith(RASTER_SUFFIX)) {
                    Files.deleteIfExists(p);
                    removed++;
                }
            }
        }
        log.info("Removed {} cached graph file(s) from {}", removed, graphsDir);
        return removed;
    }

    private static GraphSnapshot toSnapshot(String name, Artifact doc) {
        final CodeGraph graph = CodeGraph.empty();
        if (doc.nodes() != null) {
            for (NodeLine line : doc.nodes()) {
                final GraphNode n = new GraphNode(line.id(), line.kind(), line.label())
                        .group(line.group())
                        .size(line.size())
                        .title(line.title());
                if (line.attrs() != null) {
                    n.attrs().putAll(line.attrs());
                }
                graph.addNode(n);
            }
        }
        if (doc.edges() != null) {
            for (EdgeLine line : doc.edges()) {
                graph.addEdge(new GraphEdge(line.source(), line.target(), line.kind(),
                        new EdgeStyle(line.color(), line.dashed(), line.width())));
            }
        }
        final Map<String, Position> positions = new LinkedHashMap<>();
        if (doc.positions() != null) {
            for (Map.Entry<String, double[]> p : doc.positions().entrySet()) {
                final double[] xy = p.getValue();
                if (xy != null && xy.length == 2) {
                    positions.put(p.getKey(), new Position(xy[0], xy[1]));
                }
            }
        }
        final Map<String, ParsedFile> metadata = doc.metadata() == null
                ? Map.of()
                : new TreeMap<>(doc.metadata());
        return new GraphSnapshot(name, graph, positions, metadata, doc.staticImagePath());
    }

    // --- document record (written as JSON) ---

    public record Artifact(
            String schema,
            String name,
            String generatedAt,
            List<NodeLine> nodes,
            List<EdgeLine> edges,
            Map<String, double[]> positions,
            Map<String, ParsedFile> metadata,
            String staticImagePath
    ) {
    }
}

package ai.atlas.graph;

import java.util.Map;
import java.util.Objects;

import ai.atlas.model.ParsedFile;
import ai.atlas.model.Position;

/**
 * One persisted artifact: graph plus optional layout, parse metadata and raster path.
 */
public record GraphSnapshot(
        String name,
        CodeGraph graph,
        Map<String, Position> positions,      // empty when no layout was stored
        Map<String, ParsedFile> metadata,     // empty unless dependency graph
        String staticImagePath                // null when no raster exists
) {
    public GraphSnapshot {
        Objects.requireNonNull(name, "name");
        graph = graph == null ? CodeGraph.empty() : graph;
        positions = positions == null ? Map.of() : positions;
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static GraphSnapshot empty(String name) {
        return new GraphSnapshot(name, CodeGraph.empty(), Map.of(), Map.of(), null);
    }

    public static GraphSnapshot of(String name, CodeGraph graph) {
        return new GraphSnapshot(name, graph, Map.of(), Map.of(), null);
    }

    public GraphSnapshot withStaticImagePath(String path) {
        return new GraphSnapshot(name, graph, positions, metadata, path);
    }
}

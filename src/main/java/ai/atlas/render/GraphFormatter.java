package ai.atlas.render;

import java.util.ArrayList;
import java.util.List;

import ai.atlas.graph.CodeGraph;
import ai.atlas.graph.GraphEdge;
import ai.atlas.graph.GraphNode;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.Ids;

/**
 * Graph model to front-end records.
 */
public final class GraphFormatter {

    public static final String DEFAULT_GROUP = "Default";
    public static final String DEFAULT_EDGE_COLOR = "#666";

    private GraphFormatter() {
    }

    public static NodeRecord node(GraphNode n) {
        final String label = n.label() != null ? n.label() : Ids.basename(n.id());
        final String group = n.group() != null ? n.group() : DEFAULT_GROUP;
        final String tooltip = n.title() != null ? n.title() : n.id();
        return new NodeRecord(n.id(), label, group, tooltip, n.size(), n.kind().wireName());
    }

    public static EdgeRecord edge(GraphEdge e) {
        final String color = e.style().color() != null ? e.style().color() : DEFAULT_EDGE_COLOR;
        final String arrows = e.kind() == EdgeKind.CONTAINS ? null : "to";
        return new EdgeRecord(e.source(), e.target(), e.kind().wireName(),
                new EdgeRecord.Style(color, e.style().dashed(), e.style().width(), arrows));
    }

    public static List<NodeRecord> nodes(CodeGraph graph) {
        final List<NodeRecord> out = new ArrayList<>(graph.nodeCount());
        for (GraphNode n : graph.nodes()) {
            out.add(node(n));
        }
        return out;
    }

    public static List<EdgeRecord> edges(CodeGraph graph) {
        final List<EdgeRecord> out = new ArrayList<>(graph.edgeCount());
        for (GraphEdge e : graph.edges()) {
            out.add(edge(e));
        }
        return out;
    }
}

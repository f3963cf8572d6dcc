package ai.atlas.graph;

import java.util.Objects;

import ai.atlas.model.EdgeKind;

public record GraphEdge(String source, String target, EdgeKind kind, EdgeStyle style) {

    public GraphEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        style = style == null ? EdgeStyle.DEFAULT : style;
    }

    public GraphEdge(String source, String target, EdgeKind kind) {
        this(source, target, kind, EdgeStyle.DEFAULT);
    }
}

package ai.atlas.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import ai.atlas.model.NodeKind;

/**
 * Mutable node record. Visual fields ({@code group}, {@code size}, {@code title})
 * are filled by styling passes after the topology is built.
 */
public final class GraphNode {

    public static final double DEFAULT_SIZE = 15.0;

    private final String id;
    private final NodeKind kind;
    private String label;
    private String group;
    private double size = DEFAULT_SIZE;
    private String title;
    private final Map<String, Object> attrs = new LinkedHashMap<>();

    public GraphNode(String id, NodeKind kind, String label) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label == null ? id : label;
    }

    public String id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public String label() {
        return label;
    }

    public GraphNode label(String label) {
        this.label = label;
        return this;
    }

    public String group() {
        return group;
    }

    public GraphNode group(String group) {
        this.group = group;
        return this;
    }

    public double size() {
        return size;
    }

    public GraphNode size(double size) {
        this.size = size;
        return this;
    }

    /** HTML tooltip; null when none was built. */
    public String title() {
        return title;
    }

    public GraphNode title(String title) {
        this.title = title;
        return this;
    }

    public Map<String, Object> attrs() {
        return attrs;
    }

    public GraphNode attr(String key, Object value) {
        if (value == null) {
            attrs.remove(key);
        } else {
            attrs.put(key, value);
        }
        return this;
    }

    public Object attr(String key) {
        return attrs.get(key);
    }

    GraphNode copy() {
        final GraphNode n = new GraphNode(id, kind, label);
        n.group = group;
        n.size = size;
        n.title = title;
        n.attrs.putAll(attrs);
        return n;
    }
}

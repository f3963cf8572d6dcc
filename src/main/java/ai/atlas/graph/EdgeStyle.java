package ai.atlas.graph;

/**
 * Rendering hints for an edge. Null fields mean renderer default.
 */
public record EdgeStyle(String color, boolean dashed, Integer width) {

    public static final EdgeStyle DEFAULT = new EdgeStyle(null, false, null);

    public static final EdgeStyle DEPENDENCY = new EdgeStyle("#555", true, null);
    public static final EdgeStyle DEFINES = new EdgeStyle("#61afef", false, 2);
    public static final EdgeStyle CALLS = new EdgeStyle("#e5c07b", false, null);
}

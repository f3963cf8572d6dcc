package ai.atlas.model;

/**
 * Persisted edge entry of a graph artifact.
 */
public record EdgeLine(
        String source,
        String target,
        EdgeKind kind,
        String color,   // null = renderer default
        boolean dashed,
        Integer width   // null = renderer default
) {
}

package ai.atlas.model;

import java.util.Map;

/**
 * Persisted node entry of a graph artifact.
 */
public record NodeLine(
        String id,
        NodeKind kind,
        String label,
        String group,
        double size,
        String title,               // HTML tooltip, may be null
        Map<String, Object> attrs   // free-form: defType, calls, content, color
) {
}

package ai.atlas.render;

/**
 * Node as sent to the front-end.
 */
public record NodeRecord(
        String id,
        String label,
        String group,
        String tooltipHtml,
        double size,
        String kind       // file | directory | definition
) {
}

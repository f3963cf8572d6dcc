package ai.atlas.render;

/**
 * Edge as sent to the front-end.
 */
public record EdgeRecord(String from, String to, String kind, Style style) {

    public record Style(
            String color,
            boolean dashed,
            Integer width,  // null = renderer default
            String arrows   // "to" or null for undirected drawing
    ) {
    }
}

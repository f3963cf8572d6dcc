package ai.atlas.model;

/**
 * 2-D layout coordinate, roughly within [-1, 1] on both axes.
 */
public record Position(double x, double y) {
}

package ai.atlas.render;

import java.awt.AWTError;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.graph.CodeGraph;
import ai.atlas.graph.GraphEdge;
import ai.atlas.graph.GraphNode;
import ai.atlas.graph.SpringLayout;
import ai.atlas.model.Ids;
import ai.atlas.model.NodeKind;
import ai.atlas.model.Position;

/**
 * Offline PNG rendering for graphs too large to animate. Nodes are coloured
 * by group from a palette spread over the sorted group set, sized by their
 * {@code size} attribute and labelled with their basename.
 */
public final class StaticRasterGenerator {

    private static final Logger log = LoggerFactory.getLogger(StaticRasterGenerator.class);

    /** Spring constant factor and step count used when no layout is supplied. */
    public static final double LAYOUT_K_FACTOR = 5.0;
    public static final int LAYOUT_ITERATIONS = 60;

    private static final Color BACKGROUND = new Color(0x1e, 0x1e, 0x1e);
    private static final Color EDGE_COLOR = new Color(0x88, 0x88, 0x88, 50);
    private static final Color LABEL_COLOR = new Color(0xdd, 0xdd, 0xdd);
    private static final Color TITLE_COLOR = Color.WHITE;

    private final int canvasSize;
    private final boolean labels;

    public StaticRasterGenerator(int canvasSize, boolean labels) {
        if (canvasSize < 64) {
            throw new IllegalArgumentException("canvasSize must be >= 64, got " + canvasSize);
        }
        this.canvasSize = canvasSize;
        this.labels = labels;
    }

    /**
     * Renders {@code graph} to {@code target}.
     *
     * @param positions precomputed layout; when empty a fresh layout is computed
     * @return the written file, or empty if rendering failed
     */
    public Optional<Path> generate(CodeGraph graph, Map<String, Position> positions, String title, Path target) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(target, "target");
        try {
            final Map<String, Position> layout = positions == null || positions.isEmpty()
                    ? new SpringLayout(LAYOUT_K_FACTOR, LAYOUT_ITERATIONS, SpringLayout.DEFAULT_SEED).compute(graph)
                    : positions;

            final BufferedImage image = draw(graph, layout, title);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            if (!ImageIO.write(image, "png", target.toFile())) {
                log.error("No PNG writer available, static image for {} not written", title);
                return Optional.empty();
            }
            log.info("Static image for {} written to {}", title, target);
            return Optional.of(target);
        } catch (IOException | RuntimeException ex) {
            log.error("Static rendering of {} failed", title, ex);
            return Optional.empty();
        } catch (LinkageError | AWTError ex) {
            // no usable graphics / font stack in this environment
            log.error("Static rendering of {} unavailable: {}", title, ex.toString());
            return Optional.empty();
        }
    }

    private BufferedImage draw(CodeGraph graph, Map<String, Position> layout, String title) {
        final BufferedImage image = new BufferedImage(canvasSize, canvasSize, BufferedImage.TYPE_INT_RGB);
        final Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, canvasSize, canvasSize);

            final Projection projection = Projection.fit(layout, canvasSize);
            final Map<String, Color> palette = palette(graph);
            final double scale = canvasSize / 4096.0;

            g.setColor(EDGE_COLOR);
            g.setStroke(new BasicStroke((float) Math.max(0.5, scale)));
            for (GraphEdge e : graph.edges()) {
                final Position a = layout.get(e.source());
                final Position b = layout.get(e.target());
                if (a == null || b == null) {
                    continue;
                }
                final double x1 = projection.x(a);
                final double y1 = projection.y(a);
                final double x2 = projection.x(b);
                final double y2 = projection.y(b);
                g.draw(new Line2D.Double(x1, y1, x2, y2));
                arrowHead(g, x1, y1, x2, y2, 6 * scale + 2);
            }

            if (labels) {
                g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, (int) Math.max(6, Math.round(8 * scale))));
            }
            for (GraphNode n : graph.nodes()) {
                final Position p = layout.get(n.id());
                if (p == null) {
                    continue;
                }
                final double r = Math.max(1.5, Math.sqrt(n.size()) * 2.0 * scale);
                final double x = projection.x(p);
                final double y = projection.y(p);
                g.setColor(palette.getOrDefault(n.group(), Color.GRAY));
                g.fill(new Ellipse2D.Double(x - r, y - r, 2 * r, 2 * r));
                if (labels) {
                    g.setColor(LABEL_COLOR);
                    final String label = n.kind() == NodeKind.DEFINITION ? n.label() : Ids.basename(n.id());
                    g.drawString(label, (float) (x + r + 1), (float) (y + 3));
                }
            }

            if (labels && title != null) {
                g.setColor(TITLE_COLOR);
                g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, (int) Math.max(10, Math.round(28 * scale))));
                g.drawString(title + " (" + graph.nodeCount() + " nodes)", (float) (20 * scale + 4), (float) (40 * scale + 12));
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    private static void arrowHead(Graphics2D g, double x1, double y1, double x2, double y2, double len) {
        final double dx = x2 - x1;
        final double dy = y2 - y1;
        final double dist = Math.hypot(dx, dy);
        if (dist < 1e-6) {
            return;
        }
        final double ux = dx / dist;
        final double uy = dy / dist;
        final Path2D.Double head = new Path2D.Double();
        head.moveTo(x2, y2);
        head.lineTo(x2 - len * ux + len * 0.5 * uy, y2 - len * uy - len * 0.5 * ux);
        head.lineTo(x2 - len * ux - len * 0.5 * uy, y2 - len * uy + len * 0.5 * ux);
        head.closePath();
        g.fill(head);
    }

    /** Group colours spaced evenly around the hue circle in sorted group order. */
    static Map<String, Color> palette(CodeGraph graph) {
        final TreeSet<String> groups = new TreeSet<>();
        for (GraphNode n : graph.nodes()) {
            if (n.group() != null) {
                groups.add(n.group());
            }
        }
        final Map<String, Color> colors = new HashMap<>();
        int i = 0;
        for (String group : groups) {
            colors.put(group, Color.getHSBColor((float) i / groups.size(), 0.55f, 0.9f));
            i++;
        }
        return colors;
    }

    /** Maps layout coordinates onto the canvas with a 5% margin. */
    private record Projection(double minX, double minY, double scale, double offset) {

        static Projection fit(Map<String, Position> layout, int canvasSize) {
            double minX = Double.MAX_VALUE;
            double minY = Double.MAX_VALUE;
            double maxX = -Double.MAX_VALUE;
            double maxY = -Double.MAX_VALUE;
            for (Position p : layout.values()) {
                minX = Math.min(minX, p.x());
                minY = Math.min(minY, p.y());
                maxX = Math.max(maxX, p.x());
                maxY = Math.max(maxY, p.y());
            }
            if (layout.isEmpty()) {
                return new Projection(0, 0, 1, 0);
            }
            final double span = Math.max(Math.max(maxX - minX, maxY - minY), 1e-9);
            final double margin = canvasSize * 0.05;
            return new Projection(minX, minY, (canvasSize - 2 * margin) / span, margin);
        }

        double x(Position p) {
            return offset + (p.x() - minX) * scale;
        }

        double y(Position p) {
            return offset + (p.y() - minY) * scale;
        }
    }
}

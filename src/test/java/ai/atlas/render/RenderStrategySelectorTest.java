package ai.atlas.render;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.atlas.graph.CodeGraph;
import ai.atlas.graph.GraphNode;
import ai.atlas.graph.GraphSnapshot;
import ai.atlas.model.GraphKind;
import ai.atlas.model.NodeKind;
import ai.atlas.model.Tier;

import static org.junit.jupiter.api.Assertions.*;

class RenderStrategySelectorTest {

    private static final int CEILING = 3;
    private static final int INITIAL = 5;

    @TempDir
    Path tmp;

    private final RenderStrategySelector selector = new RenderStrategySelector(CEILING, INITIAL);

    private static GraphSnapshot snapshot(int nodes, String image) {
        final CodeGraph g = CodeGraph.empty();
        for (int i = 0; i < nodes; i++) {
            g.addNode(new GraphNode("f" + i, NodeKind.FILE, "f" + i));
        }
        return GraphSnapshot.of("file_graph_full", g).withStaticImagePath(image);
    }

    private String existingImage() throws IOException {
        final Path png = tmp.resolve("static_file_graph_full.png");
        Files.write(png, new byte[]{(byte) 0x89, 'P', 'N', 'G'});
        return png.toString();
    }

    @Test
    void emptyGraph() {
        final RenderPlan plan = selector.select(GraphKind.STRUCTURE, true, snapshot(0, null));
        assertEquals(RenderPlan.Mode.EMPTY, plan.mode());
        assertFalse(plan.chunked());
    }

    @Test
    void smallGraphIsInteractiveEvenWithImage() throws IOException {
        final RenderPlan plan = selector.select(GraphKind.STRUCTURE, true, snapshot(CEILING, existingImage()));
        assertEquals(RenderPlan.Mode.INTERACTIVE, plan.mode());
        assertNull(plan.staticImagePath());
        assertNull(plan.snapshot().staticImagePath(), "image dropped for small graphs");
        assertFalse(plan.chunked());
    }

    @Test
    void largeFullGraphWithImageIsStatic() throws IOException {
        final String image = existingImage();
        final RenderPlan plan = selector.select(GraphKind.DEPENDENCY, true, snapshot(CEILING + 1, image));
        assertEquals(RenderPlan.Mode.STATIC_IMAGE, plan.mode());
        assertEquals(image, plan.staticImagePath());
        assertEquals(Tier.FULL, plan.tier());
        assertEquals("Dependency Graph (Full)", plan.title());
    }

    @Test
    void missingImageFileFallsBackToInteractive() {
        final String gone = tmp.resolve("gone.png").toString();
        final RenderPlan plan = selector.select(GraphKind.STRUCTURE, true, snapshot(CEILING + 1, gone));
        assertEquals(RenderPlan.Mode.INTERACTIVE, plan.mode());
        assertFalse(plan.chunked());
    }

    @Test
    void simpleTierNeverUsesImage() throws IOException {
        final RenderPlan plan = selector.select(GraphKind.STRUCTURE, false, snapshot(INITIAL + 10, existingImage()));
        assertEquals(RenderPlan.Mode.INTERACTIVE, plan.mode());
        assertFalse(plan.chunked(), "simple tier is never chunked");
        assertEquals(Tier.SIMPLE, plan.tier());
        assertEquals("File Structure (Overview)", plan.title());
    }

    @Test
    void largeFullGraphWithoutImageIsChunked() {
        assertTrue(selector.select(GraphKind.SCOPE, true, snapshot(INITIAL + 1, null)).chunked());
        assertFalse(selector.select(GraphKind.SCOPE, true, snapshot(INITIAL, null)).chunked());
    }

    @Test
    void titles() {
        assertEquals("File Structure (Full)", RenderStrategySelector.title(GraphKind.STRUCTURE, true));
        assertEquals("Scope Graph (Overview)", RenderStrategySelector.title(GraphKind.SCOPE, false));
    }
}

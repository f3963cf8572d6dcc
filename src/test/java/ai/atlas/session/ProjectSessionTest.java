package ai.atlas.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.atlas.graph.BuildResult;
import ai.atlas.graph.CodeGraph;
import ai.atlas.io.AtlasConfig;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.GraphKind;
import ai.atlas.render.RenderPlan;
import ai.atlas.scan.ProgressListener;

import static org.junit.jupiter.api.Assertions.*;

class ProjectSessionTest {

    @TempDir
    Path tmp;

    private Path root;
    private ProjectSession session;

    @BeforeEach
    void setUp() throws IOException {
        root = tmp.resolve("proj");
        Files.createDirectories(root.resolve("src/net"));
        Files.createDirectories(root.resolve("docs"));
        Files.writeString(root.resolve("src/main.c"),
                "#include \"util.h\"\n#include \"net/socket.h\"\nint main(void) { return util(); }\n");
        Files.writeString(root.resolve("src/util.h"), "int util(void);\n");
        Files.writeString(root.resolve("src/util.c"), "#include \"util.h\"\nint util(void) { return 1; }\n");
        Files.writeString(root.resolve("src/net/socket.h"), "int sock(void);\n");
        Files.writeString(root.resolve("docs/guide.md"), "# guide\n");

        final AtlasConfig config = AtlasConfig.defaults().with(Map.of(
                "workers", "2",
                "layoutIterations", "5",
                "rasterCanvasSize", "64",
                "rasterLabels", "false"));
        session = ProjectSession.open(root, null, config);
    }

    @Test
    void dataDirDefaultsUnderRoot() {
        assertEquals(root.resolve(AtlasConfig.DATA_DIR_NAME), session.dataDir());
        assertEquals(root.resolve(".code-atlas/outputs/scope.txt"), session.scope().file());
    }

    @Test
    void dependencyBuildResolvesIncludes() throws Exception {
        final BuildResult deps = session.buildDependencies(ProgressListener.NONE);
        final CodeGraph g = deps.full().graph();

        assertTrue(g.hasEdge("src/main.c", "src/util.h"));
        assertTrue(g.hasEdge("src/main.c", "src/net/socket.h"));
        assertTrue(g.hasEdge("src/util.c", "src/util.h"));
        assertEquals(3, g.edgeCount());
        assertFalse(g.hasNode(".code-atlas"), "data dir is not part of the project");
    }

    @Test
    void scopeBuildUsesScopeSet() throws Exception {
        session.buildDependencies(ProgressListener.NONE);
        session.scope().add(List.of("src/main.c", "src/util.c"));

        final CodeGraph g = session.buildScope(ProgressListener.NONE).full().graph();

        assertTrue(g.hasNode("src/main.c::main"));
        assertTrue(g.hasNode("src/util.c::util"));
        assertEquals(EdgeKind.CALLS, g.edge("src/main.c::main", "src/util.c::util").kind());
        assertFalse(g.hasEdge("src/main.c", "src/util.c"), "no import path between the two");
    }

    @Nested
    class Display {

        @Test
        void nothingBuiltShowsEmpty() {
            final RenderPlan plan = session.loadGraph(GraphKind.STRUCTURE, true);
            assertEquals(RenderPlan.Mode.EMPTY, plan.mode());
        }

        @Test
        void loadedGraphBecomesCurrent() throws Exception {
            session.buildDependencies(ProgressListener.NONE);

            final RenderPlan plan = session.loadGraph(GraphKind.DEPENDENCY, true);

            assertEquals(RenderPlan.Mode.INTERACTIVE, plan.mode());
            assertEquals("Dependency Graph (Full)", plan.title());
            assertEquals(GraphKind.DEPENDENCY, session.currentKind().orElseThrow());
            assertSame(plan.snapshot(), session.current().orElseThrow());
        }
    }

    @Nested
    class Queries {

        @BeforeEach
        void build() throws Exception {
            session.buildDependencies(ProgressListener.NONE);
        }

        @Test
        void extrapolateListsImportersThenImports() {
            assertEquals(List.of("src/util.h", "src/main.c", "src/util.c"),
                    session.extrapolateDependencies("src/util.h"));
            assertEquals(List.of("src/main.c", "src/util.h", "src/net/socket.h"),
                    session.extrapolateDependencies("./src/main.c"));
        }

        @Test
        void extrapolateUnknownFileIsEmpty() {
            assertEquals(List.of(), session.extrapolateDependencies("nope.c"));
        }

        @Test
        void extrapolateWithoutDependencyGraphIsEmpty() throws IOException {
            session.store().clear();
            assertEquals(List.of(), session.extrapolateDependencies("src/main.c"));
        }

        @Test
        void extrapolatePrefersCurrentDependencyGraph() throws IOException {
            session.loadGraph(GraphKind.DEPENDENCY, true);
            session.store().clear();
            assertEquals(3, session.extrapolateDependencies("src/main.c").size());
        }

        @Test
        void searchMatchesSourceFilesShortestFirst() throws IOException {
            assertEquals(List.of("src/util.c", "src/util.h"), session.searchFiles("UTIL"));
            assertEquals(List.of("src/net/socket.h"), session.searchFiles("sock"));
            assertEquals(List.of(), session.searchFiles("guide"));
        }

        @Test
        void blankSearchBrowsesSourceFiles() throws IOException {
            assertEquals(List.of("src/main.c", "src/net/socket.h", "src/util.c", "src/util.h"),
                    session.searchFiles("  "));
        }

        @Test
        void searchIsCapped() throws IOException {
            for (int i = 0; i < ProjectSession.SEARCH_LIMIT + 5; i++) {
                Files.writeString(root.resolve("src/gen_" + i + ".py"), "x = 1\n");
            }
            assertEquals(ProjectSession.SEARCH_LIMIT, session.searchFiles("gen_").size());
            assertEquals("src/gen_0.py", session.searchFiles("gen_").get(0));
        }

        @Test
        void clearCacheRemovesEverything() throws IOException {
            session.scope().add(List.of("src/main.c"));
            session.loadGraph(GraphKind.DEPENDENCY, true);

            session.clearCache();

            assertFalse(session.store().exists("file_graph_full"));
            assertFalse(session.store().exists("logic_graph_full"));
            assertFalse(Files.exists(session.scope().file()));
            assertTrue(session.current().isEmpty());
            assertTrue(session.currentKind().isEmpty());
            assertEquals(RenderPlan.Mode.EMPTY, session.loadGraph(GraphKind.DEPENDENCY, true).mode());
        }
    }
}

package ai.atlas.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.atlas.io.AtlasConfig;
import ai.atlas.io.GraphStore;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.NodeKind;
import ai.atlas.model.ParsedFile;
import ai.atlas.render.StaticRasterGenerator;
import ai.atlas.scan.ParseStage;
import ai.atlas.scan.PolyglotParser;
import ai.atlas.scan.ProjectWalker;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DependencyGraphBuilderTest {

    @TempDir
    Path tmp;

    private Path root;
    private GraphStore store;
    private StaticRasterGenerator raster;

    @BeforeEach
    void setUp() throws IOException {
        root = tmp.resolve("proj");
        Files.createDirectories(root.resolve("app"));
        Files.writeString(root.resolve("README.md"), "docs\n");
        Files.writeString(root.resolve("app/main.py"), "from . import utils\nimport app.models\n");
        Files.writeString(root.resolve("app/utils.py"), "import os\n");
        Files.writeString(root.resolve("app/models.py"), "from .utils import helper\n");

        store = new GraphStore(tmp.resolve("data/graphs"));
        raster = mock(StaticRasterGenerator.class);
    }

    private DependencyGraphBuilder builder(AtlasConfig config) {
        final StructureGraphBuilder structure = new StructureGraphBuilder(store, raster, config);
        final ParseStage stage = new ParseStage(new PolyglotParser(), 2, config.progressInterval());
        return new DependencyGraphBuilder(store, structure, stage, raster, config);
    }

    private static AtlasConfig config(String... kv) {
        final Map<String, String> settings = new TreeMap<>();
        settings.put("layoutIterations", "10");
        for (int i = 0; i + 1 < kv.length; i += 2) {
            settings.put(kv[i], kv[i + 1]);
        }
        return AtlasConfig.defaults().with(settings);
    }

    // --- build ---

    @Test
    void buildsStructureFirstWhenMissing() throws Exception {
        assertFalse(store.exists("file_graph_full"));

        builder(config()).build(new ProjectWalker(root), null);

        assertTrue(store.exists("file_graph_full"));
        assertTrue(store.exists("logic_graph_full"));
        assertTrue(store.exists("logic_graph_simple"));
    }

    @Test
    void includeEdgesReplaceContainment() throws Exception {
        final BuildResult result = builder(config()).build(new ProjectWalker(root), null);
        final CodeGraph g = result.full().graph();

        assertEquals(3, g.edgeCount());
        assertTrue(g.hasEdge("app/main.py", "app/utils.py"));
        assertTrue(g.hasEdge("app/main.py", "app/models.py"));
        assertTrue(g.hasEdge("app/models.py", "app/utils.py"));
        for (GraphEdge e : g.edges()) {
            assertEquals(EdgeKind.INCLUDE, e.kind());
        }
        // structure nodes carried over, directories included
        assertEquals(NodeKind.DIRECTORY, g.node("app").kind());
        assertTrue(g.hasNode("README.md"));
    }

    @Test
    void reusesStructureLayout() throws Exception {
        final BuildResult result = builder(config()).build(new ProjectWalker(root), null);
        final GraphSnapshot structure = store.load("file_graph_full");

        assertEquals(structure.positions(), result.full().positions());
        assertEquals(structure.graph().nodeIds(), result.full().graph().nodeIds());
    }

    @Test
    void metadataCoversParsedSourcesOnly() throws Exception {
        final BuildResult result = builder(config()).build(new ProjectWalker(root), null);
        final Map<String, ParsedFile> meta = result.full().metadata();

        assertEquals(Set.of("app/main.py", "app/utils.py", "app/models.py"), meta.keySet());
        assertEquals(List.of("./utils", "app.models"), meta.get("app/main.py").imports());
        assertEquals(List.of("./utils", "app.models"), store.load("logic_graph_full").metadata().get("app/main.py").imports());
    }

    @Test
    void simpleTierIsInducedOnStructureSimple() throws Exception {
        final BuildResult result = builder(config("simpleNodeLimit", "4")).build(new ProjectWalker(root), null);
        final GraphSnapshot structureSimple = store.load("file_graph_simple");
        final CodeGraph simple = result.simple().graph();

        assertEquals(structureSimple.graph().nodeIds(), simple.nodeIds());
        for (GraphEdge e : simple.edges()) {
            assertTrue(result.full().graph().hasEdge(e.source(), e.target()));
        }
        for (String id : result.simple().metadata().keySet()) {
            assertTrue(simple.hasNode(id));
        }
    }

    @Test
    void javaImportFollowsThePackageNotTheFirstSameNamedFile() throws Exception {
        final Path java = tmp.resolve("java");
        final Path base = java.resolve("src/main/java/com");
        Files.createDirectories(base.resolve("acme/legacy"));
        Files.createDirectories(base.resolve("other"));
        Files.writeString(base.resolve("acme/Foo.java"),
                "package com.acme;\n\nimport com.other.Util;\n\nclass Foo { Util u; }\n");
        Files.writeString(base.resolve("acme/legacy/Util.java"), "package com.acme.legacy;\n\nclass Util { }\n");
        Files.writeString(base.resolve("other/Util.java"), "package com.other;\n\npublic class Util { }\n");

        final CodeGraph g = builder(config()).build(new ProjectWalker(java), null).full().graph();

        assertTrue(g.hasEdge("src/main/java/com/acme/Foo.java", "src/main/java/com/other/Util.java"));
        assertFalse(g.hasEdge("src/main/java/com/acme/Foo.java", "src/main/java/com/acme/legacy/Util.java"));
    }

    @Test
    void rebuildingIsIdempotent() throws Exception {
        final DependencyGraphBuilder b = builder(config());
        final BuildResult first = b.build(new ProjectWalker(root), null);
        final BuildResult second = b.build(new ProjectWalker(root), null);

        assertEquals(first.full().graph().nodeIds(), second.full().graph().nodeIds());
        assertEquals(first.full().graph().edgeCount(), second.full().graph().edgeCount());
    }

    @Test
    void reportsCompletion() throws Exception {
        final StringBuilder last = new StringBuilder();
        builder(config()).build(new ProjectWalker(root), (c, t, m) -> {
            last.setLength(0);
            last.append(m);
        });
        assertEquals("Dependency mapping complete.", last.toString());
    }

    // --- linking ---

    @Nested
    class Link {

        private CodeGraph files(String... ids) {
            final CodeGraph g = CodeGraph.empty();
            for (String id : ids) {
                g.addNode(new GraphNode(id, NodeKind.FILE, id));
            }
            return g;
        }

        @Test
        void failedParsesContributeNothing() {
            final CodeGraph g = files("a.c", "b.h");
            final Map<String, ParsedFile> parsed = Map.of(
                    "a.c", new ParsedFile("a.c", List.of("\"b.h\""), "boom"));

            assertEquals(0, DependencyGraphBuilder.link(g, parsed, new ImportResolver(g.nodeIds())));
        }

        @Test
        void selfImportsAndUnknownTokensAreDropped() {
            final CodeGraph g = files("src/a.c", "src/b.h");
            final Map<String, ParsedFile> parsed = Map.of(
                    "src/a.c", new ParsedFile("src/a.c", List.of("\"a.c\"", "<stdio.h>", "\"b.h\"", "\"b.h\""), null));

            assertEquals(1, DependencyGraphBuilder.link(g, parsed, new ImportResolver(g.nodeIds())));
            assertTrue(g.hasEdge("src/a.c", "src/b.h"));
            assertEquals(EdgeKind.INCLUDE, g.edge("src/a.c", "src/b.h").kind());
        }

        @Test
        void filesOutsideTheGraphAreIgnored() {
            final CodeGraph g = files("a.py");
            final Map<String, ParsedFile> parsed = Map.of(
                    "gone.py", new ParsedFile("gone.py", List.of("a"), null));

            assertEquals(0, DependencyGraphBuilder.link(g, parsed, new ImportResolver(List.of("a.py", "gone.py"))));
        }
    }
}

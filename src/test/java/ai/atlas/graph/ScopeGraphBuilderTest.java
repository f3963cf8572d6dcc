package ai.atlas.graph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.atlas.io.GraphStore;
import ai.atlas.model.EdgeKind;
import ai.atlas.model.NodeKind;
import ai.atlas.render.StaticRasterGenerator;
import ai.atlas.scan.Definition;
import ai.atlas.scan.PolyglotParser;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ScopeGraphBuilderTest {

    @TempDir
    Path tmp;

    private Path root;
    private GraphStore store;
    private StaticRasterGenerator raster;
    private ScopeGraphBuilder builder;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tmp.resolve("proj"));
        Files.writeString(root.resolve("a.py"), String.join("\n",
                "from b import helper",
                "",
                "def main():",
                "    helper()",
                "    local()",
                "",
                "def local():",
                "    pass",
                ""));
        Files.writeString(root.resolve("b.py"), String.join("\n",
                "def helper():",
                "    return compute()",
                "",
                "def compute():",
                "    return 1",
                ""));

        store = new GraphStore(tmp.resolve("data/graphs"));
        raster = mock(StaticRasterGenerator.class);
        builder = new ScopeGraphBuilder(store, new PolyglotParser(), raster);

        // a -> b -> c in the persisted dependency graph
        final CodeGraph deps = CodeGraph.empty();
        for (String f : List.of("a.py", "b.py", "c.py", "d.py")) {
            deps.addNode(new GraphNode(f, NodeKind.FILE, f.toUpperCase()).group("Root").size(20));
        }
        deps.addEdge(new GraphEdge("a.py", "b.py", EdgeKind.INCLUDE));
        deps.addEdge(new GraphEdge("b.py", "c.py", EdgeKind.INCLUDE));
        store.save(GraphSnapshot.of("logic_graph_full", deps));
    }

    // --- topology ---

    @Test
    @DisplayName("files, definitions and the three edge kinds")
    void buildsSymbolGraph() throws IOException {
        final BuildResult result = builder.build(root, List.of("a.py", "b.py", "c.py"), null);
        final CodeGraph g = result.full().graph();

        assertEquals(Set.of("a.py", "b.py", "c.py",
                "a.py::main", "a.py::local", "b.py::helper", "b.py::compute"), g.nodeIds());

        assertEquals(EdgeKind.DEPENDENCY, g.edge("a.py", "b.py").kind());
        assertEquals(EdgeKind.DEPENDENCY, g.edge("a.py", "c.py").kind(), "transitive reachability");
        assertEquals(EdgeKind.DEPENDENCY, g.edge("b.py", "c.py").kind());
        assertFalse(g.hasEdge("c.py", "a.py"));

        assertEquals(EdgeKind.DEFINES, g.edge("a.py", "a.py::main").kind());
        assertEquals(EdgeKind.DEFINES, g.edge("b.py", "b.py::compute").kind());

        assertEquals(EdgeKind.CALLS, g.edge("a.py::main", "b.py::helper").kind());
        assertEquals(EdgeKind.CALLS, g.edge("a.py::main", "a.py::local").kind());
        assertEquals(EdgeKind.CALLS, g.edge("b.py::helper", "b.py::compute").kind());

        assertEquals(10, g.edgeCount());
    }

    @Test
    void fileNodesInheritDependencyStyling() throws IOException {
        final CodeGraph g = builder.build(root, List.of("a.py", "b.py"), null).full().graph();

        assertEquals("A.PY", g.node("a.py").label());
        assertEquals(20.0, g.node("a.py").size(), 1e-9);
        assertEquals(NodeKind.FILE, g.node("a.py").kind());
    }

    @Test
    void definitionNodesCarryAttributes() throws IOException {
        final CodeGraph g = builder.build(root, List.of("a.py", "b.py"), null).full().graph();
        final GraphNode main = g.node("a.py::main");

        assertEquals(NodeKind.DEFINITION, main.kind());
        assertEquals("main", main.label());
        assertEquals(ScopeGraphBuilder.DEFINITION_SIZE, main.size(), 1e-9);
        assertEquals("<b>main</b><br><pre>def main():</pre>", main.title());
        assertEquals(Definition.FUNCTION, main.attr(ScopeGraphBuilder.ATTR_DEF_TYPE));
        assertEquals(List.of("helper", "local"), main.attr(ScopeGraphBuilder.ATTR_CALLS));
        assertTrue(String.valueOf(main.attr(ScopeGraphBuilder.ATTR_CONTENT)).startsWith("def main():"));
        assertTrue(g.node("a.py").title().contains("def main():"));
    }

    @Test
    void missingFilesKeepTheirNodeOnly() throws IOException {
        final CodeGraph g = builder.build(root, List.of("a.py", "c.py"), null).full().graph();

        assertTrue(g.hasNode("c.py"));
        assertEquals(0, g.outEdges("c.py").size());
        assertTrue(g.hasEdge("a.py", "c.py"));
    }

    @Test
    void scopeOutsideDependencyGraph() throws IOException {
        Files.writeString(root.resolve("x.py"), "def lone():\n    pass\n");
        final CodeGraph g = builder.build(root, List.of("x.py"), null).full().graph();

        assertEquals(Set.of("x.py", "x.py::lone"), g.nodeIds());
        assertEquals("Root", g.node("x.py").group());
    }

    @Test
    void simpleTierHasFilesAndDependencyEdgesOnly() throws IOException {
        final BuildResult result = builder.build(root, List.of("a.py", "b.py", "c.py"), null);
        final CodeGraph simple = result.simple().graph();

        assertEquals(Set.of("a.py", "b.py", "c.py"), simple.nodeIds());
        assertEquals(3, simple.edgeCount());
        for (GraphEdge e : simple.edges()) {
            assertEquals(EdgeKind.DEPENDENCY, e.kind());
        }
        assertNotNull(simple.node("a.py").title());
    }

    @Test
    void rasterIsAlwaysAttempted() throws IOException {
        final Path png = store.rasterPath("scope_graph_full");
        when(raster.generate(any(CodeGraph.class), eq(Map.of()), anyString(), eq(png))).thenReturn(Optional.of(png));

        final BuildResult result = builder.build(root, List.of("a.py"), null);

        verify(raster).generate(any(CodeGraph.class), eq(Map.of()), eq("scope_graph_full"), eq(png));
        assertEquals(png.toString(), result.full().staticImagePath());
        assertTrue(store.exists("scope_graph_full"));
        assertTrue(store.exists("scope_graph_simple"));
    }

    @Test
    void emptyScopeWritesEmptyTiers() throws IOException {
        final BuildResult result = builder.build(root, List.of(), null);

        assertTrue(result.full().graph().isEmpty());
        assertTrue(result.simple().graph().isEmpty());
        assertTrue(store.exists("scope_graph_full"));
        assertTrue(store.load("scope_graph_simple").graph().isEmpty());
        verifyNoInteractions(raster);
    }

    @Test
    void progressRunsThroughFiveStages() throws IOException {
        final List<String> seen = new ArrayList<>();
        builder.build(root, List.of("a.py", "b.py"), (c, t, m) -> seen.add(c + "/" + t + " " + m));

        assertEquals(List.of(
                "1/5 Building scope topology...",
                "2/5 Parsing internal structure...",
                "3/5 Linking function calls...",
                "4/5 Rendering scope visualization...",
                "5/5 Scope processing complete."), seen);
    }

    @Test
    void overloadsShareOneNode() throws IOException {
        Files.writeString(root.resolve("Over.java"), String.join("\n",
                "class Over {",
                "    void go() { a(); }",
                "    void go(int x) { b(); }",
                "    void a() { }",
                "    void b() { }",
                "}",
                ""));
        final CodeGraph g = builder.build(root, List.of("Over.java"), null).full().graph();

        assertEquals(List.of("a", "b"), g.node("Over.java::go").attr(ScopeGraphBuilder.ATTR_CALLS));
        assertTrue(g.hasEdge("Over.java::go", "Over.java::a"));
        assertTrue(g.hasEdge("Over.java::go", "Over.java::b"));
        assertEquals(5, g.nodeCount());
    }

    // --- call resolution ---

    @Nested
    class LinkCalls {

        private GraphNode def(CodeGraph g, String file, String name, String... calls) {
            if (!g.hasNode(file)) {
                g.addNode(new GraphNode(file, NodeKind.FILE, file));
            }
            return g.addNode(new GraphNode(file + "::" + name, NodeKind.DEFINITION, name)
                    .attr(ScopeGraphBuilder.ATTR_CALLS, List.of(calls)));
        }

        @Test
        void sameFileWinsThenFirstSeen() {
            final CodeGraph g = CodeGraph.empty();
            def(g, "x.py", "run", "util");
            def(g, "x.py", "util");
            def(g, "y.py", "util");
            def(g, "y.py", "go", "util", "go");
            def(g, "z.py", "start", "util");

            assertEquals(3, ScopeGraphBuilder.linkCalls(g));
            assertTrue(g.hasEdge("x.py::run", "x.py::util"));
            assertTrue(g.hasEdge("y.py::go", "y.py::util"));
            assertTrue(g.hasEdge("z.py::start", "x.py::util"));
            assertFalse(g.hasEdge("y.py::go", "y.py::go"), "no self loop");
        }

        @Test
        void ownerMatchIsExactNotPrefix() {
            final CodeGraph g = CodeGraph.empty();
            def(g, "lib.py", "util");
            def(g, "lib.pyx", "util");
            def(g, "lib.pyx", "caller", "util");

            ScopeGraphBuilder.linkCalls(g);
            assertTrue(g.hasEdge("lib.pyx::caller", "lib.pyx::util"));
        }

        @Test
        void unknownNamesAreIgnored() {
            final CodeGraph g = CodeGraph.empty();
            def(g, "a.py", "f", "print", "len");
            assertEquals(0, ScopeGraphBuilder.linkCalls(g));
        }
    }

    // --- tooltips ---

    @Nested
    class Tooltips {

        @Test
        void emptyState() {
            final String html = ScopeGraphBuilder.fileTooltip("src/empty.py", List.of());
            assertEquals("<b>empty.py</b><br><i style='font-size:10px; color:#888'>No structures found</i>", html);
        }

        @Test
        void rowsAreCappedWithMarker() {
            final List<String> rows = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                rows.add("<tr><td>row" + i + "</td></tr>");
            }
            final String html = ScopeGraphBuilder.fileTooltip("src/big.py", rows);

            assertTrue(html.contains("row19"));
            assertFalse(html.contains("row20"));
            assertTrue(html.contains("...and more..."));
            assertTrue(html.startsWith("<div style='text-align:left;'>"));
            assertTrue(html.contains(">big.py</div>"));
        }

        @Test
        void exactlyTwentyRowsHasNoMarker() {
            final List<String> rows = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                rows.add("<tr><td>row" + i + "</td></tr>");
            }
            assertFalse(ScopeGraphBuilder.fileTooltip("a.py", rows).contains("...and more..."));
        }

        @Test
        void signatureIsFirstLineWithoutBraceAndCapped() {
            final Definition braces = new Definition("f", Definition.FUNCTION, 0, 10,
                    "function f(a, b) {", "function f(a, b) {\n}", List.of());
            assertEquals("function f(a, b)", ScopeGraphBuilder.displaySignature(braces));

            final String longName = "x".repeat(80);
            final Definition longOne = new Definition(longName, Definition.FUNCTION, 0, 10,
                    "def " + longName + "():", "", List.of());
            final String shown = ScopeGraphBuilder.displaySignature(longOne);
            assertEquals(60, shown.length());
            assertTrue(shown.endsWith("..."));

            final Definition noSignature = new Definition("g", Definition.CLASS, 0, 10,
                    null, "class g:\n    pass", List.of());
            assertEquals("class g:", ScopeGraphBuilder.displaySignature(noSignature));
        }

        @Test
        void htmlIsEscaped() {
            assertEquals("a &lt;b&gt; &amp; &quot;c&quot; &#39;d&#39;", ScopeGraphBuilder.escapeHtml("a <b> & \"c\" 'd'"));
            assertEquals("", ScopeGraphBuilder.escapeHtml(null));
        }
    }
}

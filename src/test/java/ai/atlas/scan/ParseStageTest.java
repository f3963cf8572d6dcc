package ai.atlas.scan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.atlas.model.ParsedFile;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ParseStageTest {

    @TempDir
    Path root;

    private SourceParser stubParser() {
        final SourceParser parser = mock(SourceParser.class);
        when(parser.parse(any(Path.class), eq(false))).thenAnswer(inv -> {
            final Path file = inv.getArgument(0);
            final String name = file.getFileName().toString();
            if (name.startsWith("bad")) {
                return ParseResult.failure(file.toString(), "c", "syntax error");
            }
            if (name.startsWith("boom")) {
                throw new IllegalStateException("parser crashed");
            }
            return new ParseResult(file.toString(), "c", List.of("\"" + name + ".h\""), List.of(), null);
        });
        return parser;
    }

    @Test
    void parsesEveryFileImportOnly() throws Exception {
        final SourceParser parser = stubParser();
        final ParseStage stage = new ParseStage(parser, 3, 20);

        final Map<String, ParsedFile> results = stage.run(root, List.of("src/b.c", "src/a.c"), ProgressListener.NONE);

        assertEquals(List.of("src/a.c", "src/b.c"), new ArrayList<>(results.keySet()));
        assertEquals(List.of("\"a.c.h\""), results.get("src/a.c").imports());
        assertFalse(results.get("src/a.c").failed());
        verify(parser).parse(root.resolve("src/a.c"), false);
        verify(parser, never()).parse(any(Path.class), eq(true));
    }

    @Test
    void failuresAreRecordedNotThrown() throws Exception {
        final ParseStage stage = new ParseStage(stubParser(), 2, 20);

        final Map<String, ParsedFile> results = stage.run(root,
                List.of("ok.c", "bad.c", "boom.c"), ProgressListener.NONE);

        assertEquals(3, results.size());
        assertFalse(results.get("ok.c").failed());
        assertEquals("syntax error", results.get("bad.c").error());
        assertTrue(results.get("bad.c").imports().isEmpty());
        assertTrue(results.get("boom.c").failed());
        assertTrue(results.get("boom.c").error().contains("parser crashed"));
    }

    @Test
    void progressIsReportedEveryInterval() throws Exception {
        final List<Integer> reported = new ArrayList<>();
        final ParseStage stage = new ParseStage(stubParser(), 2, 2);

        stage.run(root, List.of("a.c", "b.c", "c.c", "d.c", "e.c"),
                (current, total, message) -> {
                    assertEquals(5, total);
                    reported.add(current);
                });

        assertEquals(List.of(2, 4), reported);
    }

    @Test
    void emptyInputNeverTouchesTheParser() throws Exception {
        final SourceParser parser = mock(SourceParser.class);
        final Map<String, ParsedFile> results = new ParseStage(parser, 4, 20).run(root, List.of(), null);
        assertTrue(results.isEmpty());
        verifyNoInteractions(parser);
    }

    @Test
    void realParserAgainstFiles() throws Exception {
        Files.writeString(root.resolve("main.py"), "import util\nfrom . import helpers\n");
        Files.writeString(root.resolve("notes.md"), "# notes\n");

        final Map<String, ParsedFile> results = new ParseStage(new PolyglotParser(), 2, 20)
                .run(root, List.of("main.py", "notes.md"), ProgressListener.NONE);

        assertEquals(List.of("util", "./helpers"), results.get("main.py").imports());
        assertEquals("Language .md not supported.", results.get("notes.md").error());
    }
}

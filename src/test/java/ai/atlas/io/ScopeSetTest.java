package ai.atlas.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class ScopeSetTest {

    @TempDir
    Path tmp;

    private ScopeSet scope;

    @BeforeEach
    void setUp() {
        scope = new ScopeSet(tmp.resolve("outputs").resolve(ScopeSet.FILE_NAME));
    }

    @Test
    void emptyWhenFileMissing() throws IOException {
        assertEquals(List.of(), scope.list());
        assertFalse(Files.exists(scope.file()));
    }

    @Test
    void addReturnsOnlyNewEntries() throws IOException {
        assertEquals(List.of("a.py", "src/b.py"), scope.add(List.of("src/b.py", "a.py")));
        assertEquals(List.of("c.py"), scope.add(List.of("a.py", "c.py")));
        assertEquals(List.of("a.py", "c.py", "src/b.py"), scope.list());
    }

    @Test
    void pathsAreNormalized() throws IOException {
        scope.add(List.of("./src/x.py", "src\\y.py", "  ", "src/x.py"));
        assertEquals(List.of("src/x.py", "src/y.py"), scope.list());
    }

    @Test
    void storedOnePerLineSorted() throws IOException {
        scope.add(List.of("z.c", "a.c"));
        assertEquals("a.c\nz.c\n", Files.readString(scope.file()));
    }

    @Test
    void blankLinesIgnoredOnRead() throws IOException {
        Files.createDirectories(scope.file().getParent());
        Files.writeString(scope.file(), "\nb.py\n\n  \na.py\n");
        assertEquals(List.of("a.py", "b.py"), scope.list());
    }

    @Test
    void removeReportsWhatWasThere() throws IOException {
        scope.add(List.of("a.py", "b.py"));
        assertEquals(List.of("a.py"), scope.remove(List.of("a.py", "missing.py")));
        assertEquals(List.of("b.py"), scope.list());
        assertEquals(List.of(), scope.remove(List.of("missing.py")));
    }

    @Test
    void clearEmptiesTheSet() throws IOException {
        scope.add(List.of("a.py"));
        scope.clear();
        assertEquals(List.of(), scope.list());
        assertTrue(Files.exists(scope.file()));
    }

    @Test
    void entriesSurviveTheirFiles() throws IOException {
        scope.add(List.of("deleted/long/ago.py"));
        assertEquals(List.of("deleted/long/ago.py"), new ScopeSet(scope.file()).list());
    }
}

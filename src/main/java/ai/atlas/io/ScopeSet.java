package ai.atlas.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.model.Ids;

/**
 * User-curated set of project-relative files bounding the scope graph.
 * Stored as one path per line; blank lines are ignored on read. Entries are
 * never pruned when the file they name disappears.
 */
public final class ScopeSet {

    private static final Logger log = LoggerFactory.getLogger(ScopeSet.class);

    public static final String FILE_NAME = "scope.txt";

    private final Path file;

    public ScopeSet(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    /** Current entries, sorted. */
    public List<String> list() throws IOException {
        return new ArrayList<>(read());
    }

    /**
     * @return the entries that were not present before, sorted
     */
    public List<String> add(Collection<String> paths) throws IOException {
        final TreeSet<String> current = read();
        final List<String> added = new ArrayList<>();
        for (String p : new TreeSet<>(normalized(paths))) {
            if (current.add(p)) {
                added.add(p);
            }
        }
        if (!added.isEmpty()) {
            write(current);
        }
        log.debug("Scope add: {} new of {} requested", added.size(), paths.size());
        return added;
    }

    /**
     * @return the entries actually removed, sorted
     */
    public List<String> remove(Collection<String> paths) throws IOException {
        final TreeSet<String> current = read();
        final List<String> removed = new ArrayList<>();
        for (String p : new TreeSet<>(normalized(paths))) {
            if (current.remove(p)) {
                removed.add(p);
            }
        }
        if (!removed.isEmpty()) {
            write(current);
        }
        return removed;
    }

    public void clear() throws IOException {
        write(new TreeSet<>());
    }

    private TreeSet<String> read() throws IOException {
        final TreeSet<String> entries = new TreeSet<>();
        if (!Files.isRegularFile(file)) {
            return entries;
        }
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            final String p = Ids.normalizePath(line);
            if (!p.isEmpty()) {
                entries.add(p);
            }
        }
        return entries;
    }

    private void write(TreeSet<String> entries) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        final StringBuilder sb = new StringBuilder();
        for (String e : entries) {
            sb.append(e).append('\n');
        }
        Files.writeString(file, sb.toString(), StandardCharsets.UTF_8);
    }

    private static List<String> normalized(Collection<String> paths) {
        Objects.requireNonNull(paths, "paths");
        final List<String> out = new ArrayList<>(paths.size());
        for (String p : paths) {
            final String n = Ids.normalizePath(p);
            if (!n.isEmpty()) {
                out.add(n);
            }
        }
        return out;
    }
}

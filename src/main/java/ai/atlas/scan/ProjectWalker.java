package ai.atlas.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a project tree once, skipping heavy / generated directories.
 * Entries are returned sorted so parents always precede their children.
 */
public final class ProjectWalker {

    private static final Logger log = LoggerFactory.getLogger(ProjectWalker.class);

    public static final Set<String> IGNORE_DIRS = Set.of(
            ".git", ".svn", ".hg", ".idea", ".vscode",
            "node_modules", "venv", ".venv", "env",
            "dist", "build", "target", "bin", "obj",
            "vendor", "third_party", "cmake-build-debug",
            "__pycache__"
    );

    private final Path root;
    private final Set<String> ignoredDirs;

    public ProjectWalker(Path root, Set<String> extraIgnoredDirs) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
        final Set<String> ignored = new LinkedHashSet<>(IGNORE_DIRS);
        ignored.addAll(extraIgnoredDirs);
        this.ignoredDirs = Collections.unmodifiableSet(ignored);
    }

    public ProjectWalker(Path root) {
        this(root, Set.of());
    }

    public Path root() {
        return root;
    }

    /**
     * Directories (excluding the root) and files, as '/'-separated relative paths.
     */
    public List<Entry> entries() throws IOException {
        final List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root)) {
                    final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (ignoredDirs.contains(name)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    found.add(dir);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isDirectory()) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(found);

        final List<Entry> entries = new ArrayList<>(found.size());
        for (Path p : found) {
            entries.add(new Entry(relative(p), Files.isDirectory(p)));
        }
        return entries;
    }

    /** Relative paths of files whose extension is on the parse allow-list. */
    public List<String> sourceFiles() throws IOException {
        final List<String> files = new ArrayList<>();
        for (Entry e : entries()) {
            if (!e.directory() && SourceLanguage.isSourceFile(e.path())) {
                files.add(e.path());
            }
        }
        return files;
    }

    public String relative(Path absolute) {
        return root.relativize(absolute.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public record Entry(String path, boolean directory) {
    }
}

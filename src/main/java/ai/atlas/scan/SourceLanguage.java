package ai.atlas.scan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import ai.atlas.model.Ids;

/**
 * Languages the parse stage accepts, keyed by file extension.
 */
public enum SourceLanguage {
    C("c", ".c", ".h"),
    CPP("cpp", ".cpp", ".hpp", ".cc", ".cxx"),
    PYTHON("python", ".py", ".pyw"),
    JAVASCRIPT("javascript", ".js", ".mjs", ".jsx"),
    TYPESCRIPT("typescript", ".ts", ".tsx"),
    JAVA("java", ".java"),
    KOTLIN("kotlin", ".kt"),
    RUST("rust", ".rs"),
    GO("go", ".go"),
    LUA("lua", ".lua");

    private static final Set<String> ALL_EXTENSIONS;

    static {
        final Set<String> all = new LinkedHashSet<>();
        for (SourceLanguage l : values()) {
            all.addAll(l.extensions);
        }
        ALL_EXTENSIONS = Collections.unmodifiableSet(all);
    }

    private final String id;
    private final List<String> extensions;

    SourceLanguage(String id, String... extensions) {
        this.id = id;
        this.extensions = List.of(extensions);
    }

    public String id() {
        return id;
    }

    public List<String> extensions() {
        return extensions;
    }

    public static Set<String> allowedExtensions() {
        return ALL_EXTENSIONS;
    }

    public static boolean isSourceFile(String path) {
        return ALL_EXTENSIONS.contains(Ids.extension(path).toLowerCase(Locale.ROOT));
    }

    public static Optional<SourceLanguage> forPath(String path) {
        final String ext = Ids.extension(path).toLowerCase(Locale.ROOT);
        for (SourceLanguage l : values()) {
            if (l.extensions.contains(ext)) {
                return Optional.of(l);
            }
        }
        return Optional.empty();
    }
}

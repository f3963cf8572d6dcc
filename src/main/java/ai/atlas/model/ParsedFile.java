package ai.atlas.model;

import java.util.List;

/**
 * Import-only parse outcome of one file, kept as dependency-graph metadata.
 * {@code error} is null on success.
 */
public record ParsedFile(
        String path,          // project-relative
        List<String> imports, // raw tokens, unresolved
        String error
) {
    public ParsedFile {
        imports = imports == null ? List.of() : List.copyOf(imports);
    }

    public boolean failed() {
        return error != null;
    }
}

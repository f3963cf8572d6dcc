package ai.atlas.scan;

import java.util.List;

/**
 * Outcome of one parser invocation. Failures are reported through {@code error},
 * never thrown.
 */
public record ParseResult(
        String file,
        String language,              // null when the extension is unknown
        List<String> imports,
        List<Definition> definitions, // empty unless parsed in detailed mode
        String error
) {
    public ParseResult {
        imports = imports == null ? List.of() : List.copyOf(imports);
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
    }

    public static ParseResult failure(String file, String language, String error) {
        return new ParseResult(file, language, List.of(), List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}

package ai.atlas.scan;

import java.nio.file.Path;
import java.util.Optional;

import ai.atlas.model.Ids;

/**
 * Default {@link SourceParser}: JavaParser for {@code .java}, tree-sitter
 * grammars for the other supported languages. Stateless apart from per-thread
 * parser instances, so one instance can serve every parse worker.
 */
public final class PolyglotParser implements SourceParser {

    private final JavaSourceParser javaParser = new JavaSourceParser();
    private final TreeSitterSourceParser treeSitter = new TreeSitterSourceParser();

    @Override
    public ParseResult parse(Path file, boolean detailed) {
        final String name = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        final Optional<SourceLanguage> language = SourceLanguage.forPath(name);
        if (language.isEmpty()) {
            final String ext = Ids.extension(name);
            return ParseResult.failure(file.toString(), null,
                    "Language " + (ext.isEmpty() ? name : ext) + " not supported.");
        }
        if (language.get() == SourceLanguage.JAVA) {
            return javaParser.parse(file, detailed);
        }
        return treeSitter.parse(file, language.get(), detailed);
    }
}

package ai.atlas.scan;

import java.nio.file.Path;

/**
 * Structural parser capability. Implementations must be safe to call from
 * several parse workers at once and must report unsupported languages and
 * read/parse failures through {@link ParseResult#error()} instead of throwing.
 */
public interface SourceParser {

    /**
     * @param file     absolute path of the source file
     * @param detailed when false only imports are extracted
     */
    ParseResult parse(Path file, boolean detailed);
}

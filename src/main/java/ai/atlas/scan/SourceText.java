package ai.atlas.scan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decoded file content with its UTF-8 encoding, so that both char offsets
 * (JavaParser positions) and byte offsets (syntax tree nodes) can be mapped.
 */
final class SourceText {

    private final String text;
    private final byte[] bytes;
    private final int[] lineStarts;

    private SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
            }
        }
        this.lineStarts = new int[lines];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
    }

    /** Malformed UTF-8 sequences are replaced, not rejected. */
    static SourceText read(Path file) throws IOException {
        return new SourceText(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    static SourceText of(String text) {
        return new SourceText(text);
    }

    String text() {
        return text;
    }

    int byteLength() {
        return bytes.length;
    }

    /** Char offset of a 1-based line / column pair. */
    int offset(int line, int column) {
        final int l = Math.max(1, Math.min(line, lineStarts.length));
        return Math.min(text.length(), lineStarts[l - 1] + Math.max(0, column - 1));
    }

    int byteOffset(int charOffset) {
        return text.substring(0, Math.min(charOffset, text.length())).getBytes(StandardCharsets.UTF_8).length;
    }

    /** Text between two byte offsets, clamped to the content. */
    String slice(int startByte, int endByte) {
        final int from = Math.max(0, Math.min(startByte, bytes.length));
        final int to = Math.max(from, Math.min(endByte, bytes.length));
        return new String(bytes, from, to - from, StandardCharsets.UTF_8);
    }
}

package ai.atlas.scan;

import java.util.List;

/**
 * A function or class found by a detailed parse.
 */
public record Definition(
        String name,
        String kind,          // "function" | "class"
        int startByte,
        int endByte,
        String signature,     // declaration header, may span lines
        String content,       // full source text of the definition
        List<String> calls    // distinct called names, source order
) {
    public static final String FUNCTION = "function";
    public static final String CLASS = "class";

    public Definition {
        calls = calls == null ? List.of() : List.copyOf(calls);
    }
}

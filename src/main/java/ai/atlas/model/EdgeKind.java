package ai.atlas.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeKind {
    CONTAINS,   // directory -> child
    INCLUDE,    // file -> imported file
    DEPENDENCY, // scope file -> reachable scope file
    DEFINES,    // file -> definition
    CALLS;      // definition -> definition

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EdgeKind fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

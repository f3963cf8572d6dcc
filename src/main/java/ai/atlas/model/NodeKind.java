package ai.atlas.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeKind {
    FILE,
    DIRECTORY,
    DEFINITION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeKind fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}

package ai.atlas.graph;

import java.util.Objects;

/**
 * Both persisted tiers of one build.
 */
public record BuildResult(GraphSnapshot full, GraphSnapshot simple) {

    public BuildResult {
        Objects.requireNonNull(full, "full");
        Objects.requireNonNull(simple, "simple");
    }
}

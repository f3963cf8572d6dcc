package ai.atlas.render;

import java.util.Objects;

import ai.atlas.graph.GraphSnapshot;
import ai.atlas.model.GraphKind;
import ai.atlas.model.Tier;

/**
 * How one loaded graph is to be presented.
 */
public record RenderPlan(
        Mode mode,
        GraphKind kind,
        Tier tier,
        GraphSnapshot snapshot,
        String staticImagePath,  // set only in STATIC_IMAGE mode
        boolean chunked,         // interactive with progressive delivery of the remainder
        String title
) {

    public enum Mode {
        EMPTY,
        STATIC_IMAGE,
        INTERACTIVE
    }

    public RenderPlan {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(snapshot, "snapshot");
    }

    public int nodeCount() {
        return snapshot.graph().nodeCount();
    }
}

package ai.atlas.render;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.graph.GraphSnapshot;
import ai.atlas.model.GraphKind;
import ai.atlas.model.Tier;

/**
 * Picks the presentation for a loaded graph:
 * - up to {@code interactiveCeiling} nodes: always interactive, static image dropped
 * - full tier with an existing raster: static image only
 * - otherwise interactive, chunked when a full-detail graph exceeds {@code initialLoadSize}
 */
public final class RenderStrategySelector {

    private static final Logger log = LoggerFactory.getLogger(RenderStrategySelector.class);

    private final int interactiveCeiling;
    private final int initialLoadSize;

    public RenderStrategySelector(int interactiveCeiling, int initialLoadSize) {
        this.interactiveCeiling = interactiveCeiling;
        this.initialLoadSize = initialLoadSize;
    }

    public RenderPlan select(GraphKind kind, boolean fullDetail, GraphSnapshot snapshot) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(snapshot, "snapshot");
        final Tier tier = Tier.of(fullDetail);
        final String title = title(kind, fullDetail);
        final int n = snapshot.graph().nodeCount();

        if (n == 0) {
            return new RenderPlan(RenderPlan.Mode.EMPTY, kind, tier, snapshot, null, false, title);
        }
        if (n <= interactiveCeiling) {
            // small enough for tooltips to be useful
            return new RenderPlan(RenderPlan.Mode.INTERACTIVE, kind, tier,
                    snapshot.withStaticImagePath(null), null, false, title);
        }
        final String image = snapshot.staticImagePath();
        if (fullDetail && image != null && Files.isRegularFile(Path.of(image))) {
            return new RenderPlan(RenderPlan.Mode.STATIC_IMAGE, kind, tier, snapshot, image, false, title);
        }
        if (fullDetail && image != null) {
            log.warn("Static image {} for {} is missing, falling back to interactive view", image, snapshot.name());
        }
        final boolean chunked = fullDetail && n > initialLoadSize;
        return new RenderPlan(RenderPlan.Mode.INTERACTIVE, kind, tier, snapshot, null, chunked, title);
    }

    static String title(GraphKind kind, boolean fullDetail) {
        final String base = switch (kind) {
            case STRUCTURE -> "File Structure";
            case DEPENDENCY -> "Dependency Graph";
            case SCOPE -> "Scope Graph";
        };
        return base + (fullDetail ? " (Full)" : " (Overview)");
    }
}

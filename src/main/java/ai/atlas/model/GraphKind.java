package ai.atlas.model;

import java.util.Locale;

/**
 * The three persisted graph families. {@code baseName} prefixes every artifact
 * and raster file of the kind.
 */
public enum GraphKind {
    STRUCTURE("structure", "file_graph"),
    DEPENDENCY("dependency", "logic_graph"),
    SCOPE("scope", "scope_graph");

    private final String cliName;
    private final String baseName;

    GraphKind(String cliName, String baseName) {
        this.cliName = cliName;
        this.baseName = baseName;
    }

    public String cliName() {
        return cliName;
    }

    public String baseName() {
        return baseName;
    }

    /** Artifact name of one tier, e.g. {@code logic_graph_full}. */
    public String artifactName(Tier tier) {
        return baseName + "_" + tier.suffix();
    }

    public static GraphKind fromCliName(String name) {
        final String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (GraphKind k : values()) {
            if (k.cliName.equals(n) || k.baseName.equals(n)) {
                return k;
            }
        }
        if ("file_tree".equals(n) || "files".equals(n)) {
            return STRUCTURE;
        }
        throw new IllegalArgumentException("Unknown graph kind: " + name);
    }
}

package ai.atlas.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunables of one project session. Resolution order, lowest first: built-in
 * defaults, {@code <root>/.code-atlas.properties} ({@code atlas.<key>}), explicit
 * overrides (CLI {@code --<key>=<value>}).
 */
public record AtlasConfig(
        int workers,
        int staticRenderThreshold,
        int simpleNodeLimit,
        int interactiveCeiling,
        int initialLoadSize,
        int chunkSize,
        int progressInterval,
        int rasterCanvasSize,
        boolean rasterLabels,
        int layoutIterations
) {

    private static final Logger log = LoggerFactory.getLogger(AtlasConfig.class);

    public static final String PROPERTIES_FILE = ".code-atlas.properties";
    public static final String KEY_PREFIX = "atlas.";
    public static final String DATA_DIR_NAME = ".code-atlas";

    public static final List<String> KEYS = List.of(
            "workers", "staticRenderThreshold", "simpleNodeLimit", "interactiveCeiling",
            "initialLoadSize", "chunkSize", "progressInterval", "rasterCanvasSize",
            "rasterLabels", "layoutIterations");

    public AtlasConfig {
        requirePositive("workers", workers);
        requirePositive("staticRenderThreshold", staticRenderThreshold);
        requirePositive("simpleNodeLimit", simpleNodeLimit);
        requirePositive("interactiveCeiling", interactiveCeiling);
        requirePositive("initialLoadSize", initialLoadSize);
        requirePositive("chunkSize", chunkSize);
        requirePositive("progressInterval", progressInterval);
        requirePositive("rasterCanvasSize", rasterCanvasSize);
        requirePositive("layoutIterations", layoutIterations);
    }

    public static AtlasConfig defaults() {
        return new AtlasConfig(defaultWorkers(), 2000, 2000, 50, 1500, 1000, 20, 4096, true, 50);
    }

    /** 75% of the available processors, at least one. */
    public static int defaultWorkers() {
        return Math.max(1, (int) (Runtime.getRuntime().availableProcessors() * 0.75));
    }

    /**
     * Defaults, then the project's properties file (if present), then {@code overrides}.
     *
     * @throws IllegalArgumentException on an unknown key or a malformed value
     */
    public static AtlasConfig load(Path projectRoot, Map<String, String> overrides) throws IOException {
        Objects.requireNonNull(projectRoot, "projectRoot");
        final Map<String, String> values = new LinkedHashMap<>();

        final Path file = projectRoot.resolve(PROPERTIES_FILE);
        if (Files.isRegularFile(file)) {
            final Properties props = new Properties();
            try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(r);
            }
            for (String name : props.stringPropertyNames()) {
                if (name.startsWith(KEY_PREFIX)) {
                    values.put(name.substring(KEY_PREFIX.length()), props.getProperty(name).trim());
                } else {
                    log.warn("Ignoring property without '{}' prefix in {}: {}", KEY_PREFIX, file, name);
                }
            }
            log.debug("Loaded {} setting(s) from {}", values.size(), file);
        }
        if (overrides != null) {
            values.putAll(overrides);
        }
        return defaults().with(values);
    }

    /** Copy with the given {@code key -> value} settings applied. */
    public AtlasConfig with(Map<String, String> values) {
        final Map<String, String> merged = new LinkedHashMap<>(asMap());
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (!KEYS.contains(e.getKey())) {
                throw new IllegalArgumentException("Unknown setting: " + e.getKey());
            }
            merged.put(e.getKey(), e.getValue());
        }
        return new AtlasConfig(
                intValue(merged, "workers"),
                intValue(merged, "staticRenderThreshold"),
                intValue(merged, "simpleNodeLimit"),
                intValue(merged, "interactiveCeiling"),
                intValue(merged, "initialLoadSize"),
                intValue(merged, "chunkSize"),
                intValue(merged, "progressInterval"),
                intValue(merged, "rasterCanvasSize"),
                boolValue(merged, "rasterLabels"),
                intValue(merged, "layoutIterations"));
    }

    public Map<String, String> asMap() {
        final Map<String, String> m = new LinkedHashMap<>();
        m.put("workers", String.valueOf(workers));
        m.put("staticRenderThreshold", String.valueOf(staticRenderThreshold));
        m.put("simpleNodeLimit", String.valueOf(simpleNodeLimit));
        m.put("interactiveCeiling", String.valueOf(interactiveCeiling));
        m.put("initialLoadSize", String.valueOf(initialLoadSize));
        m.put("chunkSize", String.valueOf(chunkSize));
        m.put("progressInterval", String.valueOf(progressInterval));
        m.put("rasterCanvasSize", String.valueOf(rasterCanvasSize));
        m.put("rasterLabels", String.valueOf(rasterLabels));
        m.put("layoutIterations", String.valueOf(layoutIterations));
        return m;
    }

    private static int intValue(Map<String, String> values, String key) {
        final String raw = values.get(key);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Setting " + key + " must be an integer, got: " + raw, ex);
        }
    }

    private static boolean boolValue(Map<String, String> values, String key) {
        final String raw = values.get(key).trim();
        if (!"true".equalsIgnoreCase(raw) && !"false".equalsIgnoreCase(raw)) {
            throw new IllegalArgumentException("Setting " + key + " must be true or false, got: " + raw);
        }
        return Boolean.parseBoolean(raw);
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be >= 1, got " + value);
        }
    }
}

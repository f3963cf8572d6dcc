package ai.atlas.scan;

/**
 * Build progress callback.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (current, total, message) -> { };

    void onProgress(int current, int total, String message);
}

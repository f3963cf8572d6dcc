package ai.atlas.render;

import java.util.List;

/**
 * Front-end boundary of the render pipeline. Calls arrive in the order the
 * display should apply them; {@link #appendData} only ever adds nodes and edges
 * that were not sent before for the current graph.
 */
public interface GraphView {

    void showEmpty();

    void showStaticImage(String imagePath, String title);

    /**
     * Replaces whatever is displayed.
     *
     * @param chunkLoadingActive more nodes will follow through {@link #appendData}
     */
    void render(String title, List<NodeRecord> nodes, List<EdgeRecord> edges, boolean chunkLoadingActive);

    void appendData(List<NodeRecord> nodes, List<EdgeRecord> edges);

    void updateProgress(int current, int total);

    void loadingComplete();

    void showError(String message);
}

package ai.atlas.render;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link GraphView} that writes each call as one JSON object per line, e.g.
 * {@code {"event":"appendData","nodes":[...],"edges":[...]}}. Used by the CLI
 * so that any front-end can replay the stream.
 */
public final class JsonLinesGraphView implements GraphView {

    private final PrintStream out;
    private final ObjectMapper jsonlMapper;

    public JsonLinesGraphView(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
        this.jsonlMapper = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public void showEmpty() {
        emit(event("showEmpty"));
    }

    @Override
    public void showStaticImage(String imagePath, String title) {
        final Map<String, Object> e = event("showStaticImage");
        e.put("imagePath", imagePath);
        e.put("title", title);
        emit(e);
    }

    @Override
    public void render(String title, List<NodeRecord> nodes, List<EdgeRecord> edges, boolean chunkLoadingActive) {
        final Map<String, Object> e = event("render");
        e.put("title", title);
        e.put("chunkLoadingActive", chunkLoadingActive);
        e.put("nodes", nodes);
        e.put("edges", edges);
        emit(e);
    }

    @Override
    public void appendData(List<NodeRecord> nodes, List<EdgeRecord> edges) {
        final Map<String, Object> e = event("appendData");
        e.put("nodes", nodes);
        e.put("edges", edges);
        emit(e);
    }

    @Override
    public void updateProgress(int current, int total) {
        final Map<String, Object> e = event("updateProgress");
        e.put("current", current);
        e.put("total", total);
        emit(e);
    }

    @Override
    public void loadingComplete() {
        emit(event("loadingComplete"));
    }

    @Override
    public void showError(String message) {
        final Map<String, Object> e = event("showError");
        e.put("message", message);
        emit(e);
    }

    private static Map<String, Object> event(String name) {
        final Map<String, Object> e = new LinkedHashMap<>();
        e.put("event", name);
        return e;
    }

    private void emit(Map<String, Object> event) {
        try {
            out.println(jsonlMapper.writeValueAsString(event));
            out.flush();
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}

package ai.atlas.render;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.atlas.graph.CodeGraph;
import ai.atlas.graph.GraphEdge;

/**
 * Presents {@link RenderPlan}s on a {@link GraphView}. A chunked plan paints the
 * top {@code initialLoadSize} nodes by degree first; the rest follows in
 * {@code chunkSize} pieces once the view acknowledges the page load.
 * <p>
 * Every {@link #present} starts a new generation. A chunk task re-checks its
 * generation before each call into the view, so once a newer plan is shown
 * nothing of an older one reaches the view, even when the switch happens while
 * the chunk is being assembled.
 */
public final class ProgressiveLoader {

    private static final Logger log = LoggerFactory.getLogger(ProgressiveLoader.class);

    private final GraphView view;
    private final Executor executor;
    private final int initialLoadSize;
    private final int chunkSize;

    private final AtomicLong generations = new AtomicLong();
    private volatile LoadSession active;

    public ProgressiveLoader(GraphView view, Executor executor, int initialLoadSize, int chunkSize) {
        this.view = Objects.requireNonNull(view, "view");
        this.executor = Objects.requireNonNull(executor, "executor");
        if (initialLoadSize < 1 || chunkSize < 1) {
            throw new IllegalArgumentException("initialLoadSize and chunkSize must be >= 1");
        }
        this.initialLoadSize = initialLoadSize;
        this.chunkSize = chunkSize;
    }

    /**
     * Shows the plan and makes it the active render target.
     *
     * @return generation number of this presentation
     */
    public long present(RenderPlan plan) {
        Objects.requireNonNull(plan, "plan");
        final long generation = generations.incrementAndGet();
        active = null;

        switch (plan.mode()) {
            case EMPTY -> view.showEmpty();
            case STATIC_IMAGE -> view.showStaticImage(plan.staticImagePath(), plan.title());
            case INTERACTIVE -> {
                final CodeGraph graph = plan.snapshot().graph();
                if (plan.chunked() && graph.nodeCount() > initialLoadSize) {
                    final List<String> order = graph.idsByDegreeDescending();
                    final LoadSession session = new LoadSession(generation, graph, order);
                    final List<String> first = order.subList(0, initialLoadSize);
                    session.displayed.addAll(first);
                    session.cursor = first.size();

                    final CodeGraph initial = graph.induced(first);
                    log.info("Chunked load of {}: {} of {} nodes up front", plan.title(), first.size(), order.size());
                    active = session;
                    view.render(plan.title(), GraphFormatter.nodes(initial), GraphFormatter.edges(initial), true);
                } else {
                    view.render(plan.title(), GraphFormatter.nodes(graph), GraphFormatter.edges(graph), false);
                }
            }
        }
        return generation;
    }

    /** Front-end acknowledgement that the initial page is ready; starts chunk delivery. */
    public void pageLoaded() {
        final LoadSession session = active;
        if (session == null || session.started) {
            return;
        }
        session.started = true;
        executor.execute(() -> dispatch(session));
    }

    public long currentGeneration() {
        return generations.get();
    }

    public boolean isLoading() {
        return active != null;
    }

    private void dispatch(LoadSession session) {
        if (stale(session)) {
            log.debug("Dropping chunk of stale generation {}", session.generation);
            return;
        }
        try {
            final int end = Math.min(session.cursor + chunkSize, session.order.size());
            final List<String> chunk = session.order.subList(session.cursor, end);
            final Set<String> fresh = new HashSet<>(chunk);

            final List<NodeRecord> nodes = new ArrayList<>(chunk.size());
            final List<EdgeRecord> edges = new ArrayList<>();
            for (String id : chunk) {
                nodes.add(GraphFormatter.node(session.graph.node(id)));
                for (GraphEdge e : session.graph.outEdges(id)) {
                    if (fresh.contains(e.target()) || session.displayed.contains(e.target())) {
                        edges.add(GraphFormatter.edge(e));
                    }
                }
                for (GraphEdge e : session.graph.inEdges(id)) {
                    if (session.displayed.contains(e.source())) {
                        edges.add(GraphFormatter.edge(e));
                    }
                }
            }
            session.displayed.addAll(chunk);
            session.cursor = end;

            if (stale(session)) {
                return;
            }
            view.appendData(nodes, edges);
            if (stale(session)) {
                return;
            }
            view.updateProgress(session.displayed.size(), session.order.size());

            if (session.cursor < session.order.size()) {
                executor.execute(() -> dispatch(session));
            } else {
                finish(session);
                if (!stale(session)) {
                    view.loadingComplete();
                }
            }
        } catch (RuntimeException ex) {
            log.error("Chunk delivery failed at node {} of {}", session.cursor, session.order.size(), ex);
            finish(session);
            if (!stale(session)) {
                view.showError("Failed to load graph chunk: " + ex.getMessage());
            }
        }
    }

    /** True once a later {@link #present} has superseded the session. */
    private boolean stale(LoadSession session) {
        return session.generation != generations.get();
    }

    private void finish(LoadSession session) {
        if (active == session) {
            active = null;
        }
    }

    private static final class LoadSession {
        final long generation;
        final CodeGraph graph;
        final List<String> order;        // degree descending
        final Set<String> displayed = new HashSet<>();
        int cursor;
        volatile boolean started;

        LoadSession(long generation, CodeGraph graph, List<String> order) {
            this.generation = generation;
            this.graph = graph;
            this.order = order;
        }
    }
}

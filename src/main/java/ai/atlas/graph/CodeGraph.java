package ai.atlas.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed simple graph over string ids. Iteration order is insertion order for
 * nodes and edges; adding an existing edge replaces its kind/style (no multi-edges).
 * Every edge endpoint must already exist as a node.
 */
public final class CodeGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> out = new LinkedHashMap<>();
    private final Map<String, Set<String>> in = new LinkedHashMap<>();
    private int edgeCount;

    public static CodeGraph empty() {
        return new CodeGraph();
    }

    // --- nodes ---

    /** Adds the node, or returns the existing node with the same id. */
    public GraphNode addNode(GraphNode node) {
        Objects.requireNonNull(node, "node");
        final GraphNode existing = nodes.get(node.id());
        if (existing != null) {
            return existing;
        }
        nodes.put(node.id(), node);
        out.put(node.id(), new LinkedHashMap<>());
        in.put(node.id(), new LinkedHashSet<>());
        return node;
    }

    /** Adds or replaces the node; existing edges are kept. */
    public GraphNode putNode(GraphNode node) {
        Objects.requireNonNull(node, "node");
        if (!nodes.containsKey(node.id())) {
            return addNode(node);
        }
        nodes.put(node.id(), node);
        return node;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public GraphNode node(String id) {
        return nodes.get(id);
    }

    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    // --- edges ---

    public GraphEdge addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge");
        if (!nodes.containsKey(edge.source())) {
            throw new IllegalArgumentException("Unknown edge source: " + edge.source());
        }
        if (!nodes.containsKey(edge.target())) {
            throw new IllegalArgumentException("Unknown edge target: " + edge.target());
        }
        final GraphEdge previous = out.get(edge.source()).put(edge.target(), edge);
        if (previous == null) {
            in.get(edge.target()).add(edge.source());
            edgeCount++;
        }
        return edge;
    }

    public boolean hasEdge(String source, String target) {
        final Map<String, GraphEdge> targets = out.get(source);
        return targets != null && targets.containsKey(target);
    }

    public GraphEdge edge(String source, String target) {
        final Map<String, GraphEdge> targets = out.get(source);
        return targets == null ? null : targets.get(target);
    }

    public List<GraphEdge> edges() {
        final List<GraphEdge> all = new ArrayList<>(edgeCount);
        for (Map<String, GraphEdge> targets : out.values()) {
            all.addAll(targets.values());
        }
        return all;
    }

    public int edgeCount() {
        return edgeCount;
    }

    public void removeAllEdges() {
        for (Map<String, GraphEdge> targets : out.values()) {
            targets.clear();
        }
        for (Set<String> sources : in.values()) {
            sources.clear();
        }
        edgeCount = 0;
    }

    public Set<String> successors(String id) {
        final Map<String, GraphEdge> targets = out.get(id);
        return targets == null ? Set.of() : Collections.unmodifiableSet(targets.keySet());
    }

    public Set<String> predecessors(String id) {
        final Set<String> sources = in.get(id);
        return sources == null ? Set.of() : Collections.unmodifiableSet(sources);
    }

    public List<GraphEdge> outEdges(String id) {
        final Map<String, GraphEdge> targets = out.get(id);
        return targets == null ? List.of() : new ArrayList<>(targets.values());
    }

    public List<GraphEdge> inEdges(String id) {
        final Set<String> sources = in.get(id);
        if (sources == null) {
            return List.of();
        }
        final List<GraphEdge> result = new ArrayList<>(sources.size());
        for (String s : sources) {
            result.add(out.get(s).get(id));
        }
        return result;
    }

    // --- metrics / queries ---

    /** In-degree plus out-degree. */
    public int degree(String id) {
        final Map<String, GraphEdge> targets = out.get(id);
        if (targets == null) {
            return 0;
        }
        return targets.size() + in.get(id).size();
    }

    public Map<String, Integer> degrees() {
        final Map<String, Integer> result = new LinkedHashMap<>(nodes.size() * 2);
        for (String id : nodes.keySet()) {
            result.put(id, degree(id));
        }
        return result;
    }

    /** True if a directed path of length >= 1 leads from source to target. */
    public boolean hasPath(String source, String target) {
        if (!nodes.containsKey(source) || !nodes.containsKey(target)) {
            return false;
        }
        final Set<String> seen = new HashSet<>();
        final Deque<String> queue = new ArrayDeque<>(out.get(source).keySet());
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            if (current.equals(target)) {
                return true;
            }
            if (seen.add(current)) {
                queue.addAll(out.get(current).keySet());
            }
        }
        return false;
    }

    /**
     * Node ids sorted by degree descending; ties keep insertion order.
     */
    public List<String> idsByDegreeDescending() {
        final Map<String, Integer> degrees = degrees();
        final List<String> ids = new ArrayList<>(nodes.keySet());
        ids.sort(Comparator.comparing(degrees::get, Comparator.reverseOrder()));
        return ids;
    }

    /**
     * Subgraph induced on {@code ids}: copies of the selected nodes and every edge
     * of this graph whose endpoints are both selected. Unknown ids are ignored.
     */
    public CodeGraph induced(Collection<String> ids) {
        final Set<String> keep = new HashSet<>(ids);
        final CodeGraph sub = new CodeGraph();
        for (GraphNode n : nodes.values()) {
            if (keep.contains(n.id())) {
                sub.addNode(n.copy());
            }
        }
        for (GraphEdge e : edges()) {
            if (sub.hasNode(e.source()) && sub.hasNode(e.target())) {
                sub.addEdge(e);
            }
        }
        return sub;
    }

    /** Induced subgraph of the {@code limit} highest-degree nodes, or a full copy if smaller. */
    public CodeGraph topByDegree(int limit) {
        if (nodes.size() <= limit) {
            return copy();
        }
        return induced(idsByDegreeDescending().subList(0, limit));
    }

    public CodeGraph copy() {
        return induced(nodes.keySet());
    }
}

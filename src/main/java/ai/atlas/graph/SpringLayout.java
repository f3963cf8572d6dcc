package ai.atlas.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import ai.atlas.model.Position;

/**
 * Seeded Fruchterman-Reingold layout. Edges are treated as undirected springs.
 * Above {@link #EXACT_LIMIT} nodes repulsion is only evaluated between nodes in
 * neighbouring grid cells of width 2k.
 */
public final class SpringLayout {

    public static final long DEFAULT_SEED = 42L;
    static final int EXACT_LIMIT = 1000;

    private final double kFactor;
    private final int iterations;
    private final long seed;

    /**
     * @param kFactor    optimal distance is {@code kFactor / sqrt(nodeCount)}
     * @param iterations cooling steps
     */
    public SpringLayout(double kFactor, int iterations, long seed) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be >= 1");
        }
        this.kFactor = kFactor;
        this.iterations = iterations;
        this.seed = seed;
    }

    public Map<String, Position> compute(CodeGraph graph) {
        final int n = graph.nodeCount();
        final Map<String, Position> result = new LinkedHashMap<>();
        if (n == 0) {
            return result;
        }
        final List<String> ids = new ArrayList<>(graph.nodeIds());
        if (n == 1) {
            result.put(ids.get(0), new Position(0.0, 0.0));
            return result;
        }

        final Map<String, Integer> index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            index.put(ids.get(i), i);
        }
        final int[][] neighbours = undirectedNeighbours(graph, ids, index);

        final Random random = new Random(seed);
        final double[] x = new double[n];
        final double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = random.nextDouble();
            y[i] = random.nextDouble();
        }

        final double k = kFactor / Math.sqrt(n);
        double temperature = 0.1;
        final double cooling = temperature / (iterations + 1);
        final double[] dx = new double[n];
        final double[] dy = new double[n];

        for (int iter = 0; iter < iterations; iter++) {
            java.util.Arrays.fill(dx, 0.0);
            java.util.Arrays.fill(dy, 0.0);

            if (n <= EXACT_LIMIT) {
                for (int i = 0; i < n; i++) {
                    for (int j = i + 1; j < n; j++) {
                        repel(i, j, x, y, dx, dy, k);
                    }
                }
            } else {
                repelWithGrid(x, y, dx, dy, k);
            }

            for (int i = 0; i < n; i++) {
                for (int j : neighbours[i]) {
                    if (j <= i) {
                        continue;
                    }
                    final double ddx = x[i] - x[j];
                    final double ddy = y[i] - y[j];
                    final double dist = Math.max(Math.hypot(ddx, ddy), 0.01);
                    final double force = dist / k;
                    dx[i] -= ddx * force;
                    dy[i] -= ddy * force;
                    dx[j] += ddx * force;
                    dy[j] += ddy * force;
                }
            }

            for (int i = 0; i < n; i++) {
                final double len = Math.max(Math.hypot(dx[i], dy[i]), 0.01);
                x[i] += dx[i] * temperature / len;
                y[i] += dy[i] * temperature / len;
            }
            temperature -= cooling;
        }

        rescale(x, y);
        for (int i = 0; i < n; i++) {
            result.put(ids.get(i), new Position(x[i], y[i]));
        }
        return result;
    }

    private static void repel(int i, int j, double[] x, double[] y, double[] dx, double[] dy, double k) {
        final double ddx = x[i] - x[j];
        final double ddy = y[i] - y[j];
        final double dist2 = Math.max(ddx * ddx + ddy * ddy, 1e-4);
        final double force = k * k / dist2;
        dx[i] += ddx * force;
        dy[i] += ddy * force;
        dx[j] -= ddx * force;
        dy[j] -= ddy * force;
    }

    private static void repelWithGrid(double[] x, double[] y, double[] dx, double[] dy, double k) {
        final double cell = 2 * k;
        final Map<Long, List<Integer>> grid = new HashMap<>();
        for (int i = 0; i < x.length; i++) {
            grid.computeIfAbsent(cellKey(x[i], y[i], cell), key -> new ArrayList<>()).add(i);
        }
        for (int i = 0; i < x.length; i++) {
            final long cx = (long) Math.floor(x[i] / cell);
            final long cy = (long) Math.floor(y[i] / cell);
            for (long gx = cx - 1; gx <= cx + 1; gx++) {
                for (long gy = cy - 1; gy <= cy + 1; gy++) {
                    final List<Integer> members = grid.get(pack(gx, gy));
                    if (members == null) {
                        continue;
                    }
                    for (int j : members) {
                        if (j > i) {
                            repel(i, j, x, y, dx, dy, k);
                        }
                    }
                }
            }
        }
    }

    private static long cellKey(double x, double y, double cell) {
        return pack((long) Math.floor(x / cell), (long) Math.floor(y / cell));
    }

    private static long pack(long gx, long gy) {
        return (gx << 32) ^ (gy & 0xffffffffL);
    }

    private static int[][] undirectedNeighbours(CodeGraph graph, List<String> ids, Map<String, Integer> index) {
        final List<List<Integer>> adj = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            adj.add(new ArrayList<>());
        }
        for (GraphEdge e : graph.edges()) {
            final int s = index.get(e.source());
            final int t = index.get(e.target());
            if (s == t) {
                continue;
            }
            adj.get(s).add(t);
            adj.get(t).add(s);
        }
        final int[][] result = new int[ids.size()][];
        for (int i = 0; i < ids.size(); i++) {
            result[i] = adj.get(i).stream().distinct().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    /** Centers the layout and scales it so the largest coordinate magnitude is 1. */
    private static void rescale(double[] x, double[] y) {
        double mx = 0;
        double my = 0;
        for (int i = 0; i < x.length; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= x.length;
        my /= y.length;
        double lim = 0;
        for (int i = 0; i < x.length; i++) {
            x[i] -= mx;
            y[i] -= my;
            lim = Math.max(lim, Math.max(Math.abs(x[i]), Math.abs(y[i])));
        }
        if (lim > 0) {
            for (int i = 0; i < x.length; i++) {
                x[i] /= lim;
                y[i] /= lim;
            }
        }
    }
}

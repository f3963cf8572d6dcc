package ai.atlas.graph;

import java.util.Map;

import ai.atlas.model.Ids;

/**
 * Visual annotation pass shared by every graph kind. Topology is not touched.
 * <ul>
 *   <li>{@code group}: parent directory (owning file's directory for definitions), "Root" at top level</li>
 *   <li>{@code size}: degree scaled linearly into [{@value #MIN_SIZE}, {@value #MAX_SIZE}]</li>
 * </ul>
 */
public final class GraphStyler {

    public static final double MIN_SIZE = 5.0;
    public static final double MAX_SIZE = 50.0;

    private GraphStyler() {
    }

    public static void applyVisualStyles(CodeGraph graph) {
        if (graph.isEmpty()) {
            return;
        }
        final Map<String, Integer> degrees = graph.degrees();
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int d : degrees.values()) {
            min = Math.min(min, d);
            max = Math.max(max, d);
        }

        for (GraphNode node : graph.nodes()) {
            node.group(groupOf(node.id()));
            node.size(scale(degrees.get(node.id()), min, max));
        }
    }

    public static String groupOf(String id) {
        final String folder = Ids.parentDir(Ids.ownerPath(id));
        return folder.isEmpty() ? Ids.ROOT_GROUP : folder;
    }

    static double scale(int degree, int min, int max) {
        if (max <= min) {
            return (MIN_SIZE + MAX_SIZE) / 2.0;
        }
        final double norm = (double) (degree - min) / (max - min);
        return MIN_SIZE + norm * (MAX_SIZE - MIN_SIZE);
    }
}

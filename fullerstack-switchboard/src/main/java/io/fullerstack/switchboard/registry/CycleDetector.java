package io.fullerstack.switchboard.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Depth-first cycle detection over a {@link ReachabilityGraph}.
 *
 * <p>Start channels and successors are both visited in channel-name order, so the reported
 * cycle is reproducible. When the traversal meets a channel already on the current path, the
 * cycle is the path slice from that channel's first occurrence to the end.
 *
 * <p>Channels whose subtree has been fully explored are not entered again. Any cycle through
 * such a channel would already have been reported when it was first explored, so the result
 * equals that of an exhaustive search.
 */
public final class CycleDetector {

    private static final byte UNVISITED = 0;
    private static final byte ON_PATH = 1;
    private static final byte DONE = 2;

    private final ReachabilityGraph graph;
    private final int[] order;
    private final byte[] marks;
    private final List<Integer> path = new ArrayList<>();

    private CycleDetector(ReachabilityGraph graph) {
        this.graph = graph;
        this.order = graph.handlesByName();
        this.marks = new byte[graph.size()];
    }

    /**
     * Finds the first cycle in name order.
     *
     * @return the channels of the cycle, without repeating the first one at the end, or empty
     *         if the graph is acyclic
     */
    public static Optional<List<String>> findCycle(ReachabilityGraph graph) {
        return new CycleDetector(graph).run();
    }

    private Optional<List<String>> run() {
        for (int start : order) {
            if (marks[start] == UNVISITED) {
                List<String> cycle = visit(start);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(int node) {
        marks[node] = ON_PATH;
        path.add(node);
        for (int next : order) {
            if (!graph.hasEdge(node, next)) {
                continue;
            }
            if (marks[next] == ON_PATH) {
                return slice(next);
            }
            if (marks[next] == UNVISITED) {
                List<String> cycle = visit(next);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        marks[node] = DONE;
        return null;
    }

    private List<String> slice(int repeated) {
        List<String> chain = new ArrayList<>();
        for (int i = path.indexOf(repeated); i < path.size(); i++) {
            chain.add(graph.name(path.get(i)));
        }
        return chain;
    }
}

package io.fullerstack.switchboard.registry;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Persistent channel-to-channel reachability graph.
 *
 * <p>Channels live in an arena addressed by integer handles assigned in declaration order;
 * edges are index pairs stored as one {@link BitSet} of successors per handle. The graph is
 * append-only: nodes and edges are never removed.
 *
 * <p>Not thread-safe. The registry mutates it only at subscribe time, and validates
 * candidate edges on a {@link #copy()} before swapping it in.
 */
public final class ReachabilityGraph {

    private final List<String> names;
    private final Map<String, Integer> handles;
    private final List<BitSet> successors;

    public ReachabilityGraph() {
        this.names = new ArrayList<>();
        this.handles = new HashMap<>();
        this.successors = new ArrayList<>();
    }

    private ReachabilityGraph(ReachabilityGraph source) {
        this.names = new ArrayList<>(source.names);
        this.handles = new HashMap<>(source.handles);
        this.successors = new ArrayList<>(source.successors.size());
        for (BitSet set : source.successors) {
            this.successors.add((BitSet) set.clone());
        }
    }

    /**
     * Adds a node, returning its handle. Adding an existing name returns the existing handle.
     */
    public int addNode(String name) {
        Integer existing = handles.get(name);
        if (existing != null) {
            return existing;
        }
        int handle = names.size();
        names.add(name);
        handles.put(name, handle);
        successors.add(new BitSet());
        return handle;
    }

    public OptionalInt handle(String name) {
        Integer handle = handles.get(name);
        return handle == null ? OptionalInt.empty() : OptionalInt.of(handle);
    }

    public String name(int handle) {
        return names.get(handle);
    }

    public int size() {
        return names.size();
    }

    /**
     * @return true if the edge was not present before
     */
    public boolean addEdge(int from, int to) {
        BitSet set = successors.get(from);
        boolean added = !set.get(to);
        set.set(to);
        return added;
    }

    public boolean hasEdge(int from, int to) {
        return successors.get(from).get(to);
    }

    /**
     * Handles ordered by channel name; the traversal order used by cycle detection.
     */
    public int[] handlesByName() {
        return handles.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .mapToInt(Map.Entry::getValue)
            .toArray();
    }

    /**
     * Whether {@code to} is reachable from {@code from} through one or more edges.
     */
    public boolean reaches(int from, int to) {
        BitSet seen = new BitSet(size());
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            BitSet next = successors.get(pending.pop());
            for (int i = next.nextSetBit(0); i >= 0; i = next.nextSetBit(i + 1)) {
                if (i == to) {
                    return true;
                }
                if (!seen.get(i)) {
                    seen.set(i);
                    pending.push(i);
                }
            }
        }
        return false;
    }

    /**
     * All edges, sorted by source name then target name.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>();
        for (int from = 0; from < successors.size(); from++) {
            BitSet set = successors.get(from);
            for (int to = set.nextSetBit(0); to >= 0; to = set.nextSetBit(to + 1)) {
                edges.add(new Edge(names.get(from), names.get(to)));
            }
        }
        edges.sort(Comparator.naturalOrder());
        return edges;
    }

    public int edgeCount() {
        int count = 0;
        for (BitSet set : successors) {
            count += set.cardinality();
        }
        return count;
    }

    /**
     * Deep copy used as a scratch graph for validating staged edges.
     */
    public ReachabilityGraph copy() {
        return new ReachabilityGraph(this);
    }

    @Override
    public String toString() {
        return "ReachabilityGraph[nodes=" + size() + ", edges=" + edgeCount() + "]";
    }
}

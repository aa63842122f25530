package io.fullerstack.switchboard.registry;

import java.util.Comparator;

/**
 * A reachability edge: a handler listening on {@code from} may emit on {@code to}.
 */
public record Edge(String from, String to) implements Comparable<Edge> {

    private static final Comparator<Edge> ORDER =
        Comparator.comparing(Edge::from).thenComparing(Edge::to);

    @Override
    public int compareTo(Edge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}

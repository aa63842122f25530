package io.fullerstack.switchboard.export;

import io.fullerstack.switchboard.registry.ChannelRecord;
import io.fullerstack.switchboard.registry.Edge;
import io.fullerstack.switchboard.registry.HandlerIdentity;
import io.fullerstack.switchboard.registry.Registry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Renders a registry's reachability graph as Graphviz DOT text.
 *
 * <p>One node per declared name, shaped by kind: channels are ellipses, slots boxes and
 * singles dashed boxes. One edge per reachability edge, labelled with the handlers that
 * listen on its source and emit into its target. Output is sorted, so it is stable across
 * runs and suitable for diffing.
 */
public final class GraphvizExporter {

    private final Registry registry;
    private final String graphName;
    private final String rankdir;

    public GraphvizExporter(Registry registry, String graphName, String rankdir) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.graphName = Objects.requireNonNull(graphName, "graphName cannot be null");
        this.rankdir = Objects.requireNonNull(rankdir, "rankdir cannot be null");
    }

    public String render() {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote(graphName)).append(" {\n");
        dot.append("\trankdir=").append(rankdir).append(";\n");
        for (ChannelRecord record : registry.records()) {
            dot.append('\t').append(quote(record.name()))
                .append(" [shape=").append(shape(record))
                .append(", label=").append(quote(record.name() + "\n" + record.kind().name().toLowerCase()))
                .append("];\n");
        }
        for (Edge edge : registry.edges()) {
            dot.append('\t').append(quote(edge.from())).append(" -> ").append(quote(edge.to()));
            String label = responsible(edge);
            if (!label.isEmpty()) {
                dot.append(" [label=").append(quote(label)).append(']');
            }
            dot.append(";\n");
        }
        return dot.append("}\n").toString();
    }

    public void writeTo(Path path) throws IOException {
        Files.writeString(path, render(), StandardCharsets.UTF_8);
    }

    private String responsible(Edge edge) {
        SortedSet<HandlerIdentity> handlers = new TreeSet<>(registry.record(edge.from()).orElseThrow().listeners());
        handlers.retainAll(registry.record(edge.to()).orElseThrow().emitters());
        StringJoiner joiner = new StringJoiner(",");
        for (HandlerIdentity handler : handlers) {
            joiner.add(handler.displayName());
        }
        return joiner.toString();
    }

    private static String shape(ChannelRecord record) {
        switch (record.kind()) {
            case SLOT:
                return "box";
            case SINGLE:
                return "box, style=dashed";
            default:
                return "ellipse";
        }
    }

    private static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
    }
}

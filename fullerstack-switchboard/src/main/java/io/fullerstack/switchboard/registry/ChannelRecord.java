package io.fullerstack.switchboard.registry;

import lombok.NonNull;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Diagnostic record for one declared name: its multiplicity and the handler identities
 * recorded as listening on it and emitting into it.
 *
 * <p>Both sets are append-only, mirroring the reachability graph, so the handlers named for
 * an edge never disappear while the edge itself remains.
 */
public final class ChannelRecord {

    private final String name;
    private final ChannelKind kind;
    private final SortedSet<HandlerIdentity> listeners = new TreeSet<>();
    private final SortedSet<HandlerIdentity> emitters = new TreeSet<>();

    ChannelRecord(@NonNull String name, @NonNull ChannelKind kind) {
        this.name = name;
        this.kind = kind;
    }

    public String name() {
        return name;
    }

    public ChannelKind kind() {
        return kind;
    }

    public SortedSet<HandlerIdentity> listeners() {
        return Collections.unmodifiableSortedSet(listeners);
    }

    public SortedSet<HandlerIdentity> emitters() {
        return Collections.unmodifiableSortedSet(emitters);
    }

    void addListener(HandlerIdentity identity) {
        listeners.add(identity);
    }

    void addEmitter(HandlerIdentity identity) {
        emitters.add(identity);
    }

    @Override
    public String toString() {
        return "ChannelRecord[name=" + name + ", kind=" + kind
            + ", listeners=" + listeners + ", emitters=" + emitters + "]";
    }
}

package io.fullerstack.switchboard.registry;

import io.fullerstack.switchboard.error.DuplicateDeclarationException;
import io.fullerstack.switchboard.error.DuplicateDeclarationException.Direction;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Transient record of one in-flight subscription: which names the handler listens on and
 * which it emits into. Created by {@link Registry#beginSubscription} and closed by
 * {@link Registry#endSubscription} or {@link Registry#abandonSubscription}.
 */
public final class ConstructionFrame {

    private final HandlerIdentity identity;
    private final Set<String> listens = new LinkedHashSet<>();
    private final Set<String> emits = new LinkedHashSet<>();
    private boolean open = true;

    ConstructionFrame(HandlerIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
    }

    public HandlerIdentity identity() {
        return identity;
    }

    public Set<String> listens() {
        return Collections.unmodifiableSet(listens);
    }

    public Set<String> emits() {
        return Collections.unmodifiableSet(emits);
    }

    public boolean isOpen() {
        return open;
    }

    void listen(String channel) {
        if (!listens.add(channel)) {
            throw new DuplicateDeclarationException(identity, channel, Direction.LISTEN);
        }
    }

    void emit(String channel) {
        if (!emits.add(channel)) {
            throw new DuplicateDeclarationException(identity, channel, Direction.EMIT);
        }
    }

    void close() {
        open = false;
    }

    @Override
    public String toString() {
        return "ConstructionFrame[" + identity + ", listens=" + listens + ", emits=" + emits
            + (open ? "" : ", closed") + "]";
    }
}

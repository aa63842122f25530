package io.fullerstack.switchboard.subscriber;

import io.fullerstack.switchboard.container.Channel;
import io.fullerstack.switchboard.container.MembershipContainer;
import io.fullerstack.switchboard.container.Single;
import io.fullerstack.switchboard.container.Slot;
import io.fullerstack.switchboard.error.ForeignRegistryException;
import io.fullerstack.switchboard.registry.ConstructionFrame;
import io.fullerstack.switchboard.registry.Registry;

import java.util.Objects;

/**
 * Handed to {@link Subscriber#create}; records each container the handler is going to emit
 * into and gives it back. Only valid while {@code create} runs.
 */
public final class Emitters {

    private final Registry registry;
    private final ConstructionFrame frame;

    public Emitters(Registry registry, ConstructionFrame frame) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.frame = Objects.requireNonNull(frame, "frame cannot be null");
    }

    public <T> Channel<T> channel(Channel<T> channel) {
        return declare(channel);
    }

    public <T> Slot<T> slot(Slot<T> slot) {
        return declare(slot);
    }

    public <T> Single<T> single(Single<T> single) {
        return declare(single);
    }

    private <C extends MembershipContainer> C declare(C container) {
        Objects.requireNonNull(container, "container cannot be null");
        if (container.registry() != registry) {
            throw new ForeignRegistryException(container.name());
        }
        registry.recordEmit(frame, container.name());
        return container;
    }
}

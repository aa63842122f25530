package io.fullerstack.switchboard.container;

import io.fullerstack.switchboard.registry.ChannelKind;
import io.fullerstack.switchboard.registry.Registry;

/**
 * Container for exactly one handler. A hub refuses to pass wiring verification while any of
 * its slots is empty.
 *
 * @param <T> the type the handler is delivered as
 */
public final class Slot<T> extends AbstractSlot<T> {

    public Slot(String name) {
        this(name, null);
    }

    public Slot(String name, Registry registry) {
        super(name, registry);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.SLOT;
    }
}

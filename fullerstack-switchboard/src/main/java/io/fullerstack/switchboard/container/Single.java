package io.fullerstack.switchboard.container;

import io.fullerstack.switchboard.registry.ChannelKind;
import io.fullerstack.switchboard.registry.Registry;

import java.util.Optional;
import java.util.function.Function;

/**
 * Container for at most one handler. Unlike a {@link Slot} it may legitimately stay empty;
 * callers that accept an absent handler use {@link #dispatchIfPresent}.
 *
 * @param <T> the type the handler is delivered as
 */
public final class Single<T> extends AbstractSlot<T> {

    public Single(String name) {
        this(name, null);
    }

    public Single(String name, Registry registry) {
        super(name, registry);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.SINGLE;
    }

    /**
     * Delivers to the occupant if there is one. A {@code null} result is reported as empty too.
     */
    public <R> Optional<R> dispatchIfPresent(Function<? super T, ? extends R> action) {
        if (isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(dispatch(action));
    }
}

package io.fullerstack.switchboard.container;

import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.registry.ChannelKind;
import io.fullerstack.switchboard.registry.Registry;

/**
 * A named set of handler cells that a dispatch reaches.
 *
 * <p>Containers created by a hub are bound to its registry and are only joined through
 * subscriptions. Standalone containers have no registry; they are used directly, without
 * any subscribe-time checking.
 */
public interface MembershipContainer {

    String name();

    ChannelKind kind();

    /**
     * The registry the name is declared in, or {@code null} for a standalone container.
     */
    Registry registry();

    boolean isEmpty();

    /**
     * Whether a dispatch over this container is in progress.
     */
    boolean isDispatching();

    /**
     * Removes every membership of {@code cell}.
     *
     * @return number of memberships removed
     * @throws IllegalStateException if the container is being dispatched
     */
    int detach(ExclusivityCell<?> cell);
}

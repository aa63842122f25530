package io.fullerstack.switchboard.subscriber;

import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.container.AbstractSlot;
import io.fullerstack.switchboard.container.Channel;
import io.fullerstack.switchboard.container.MembershipContainer;
import io.fullerstack.switchboard.container.Single;
import io.fullerstack.switchboard.container.Slot;
import io.fullerstack.switchboard.error.ForeignRegistryException;
import io.fullerstack.switchboard.error.SlotOccupiedException;
import io.fullerstack.switchboard.registry.ConstructionFrame;
import io.fullerstack.switchboard.registry.Registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Handed to {@link Subscriber#listen}; records each container the handler listens on and
 * stages the corresponding join.
 *
 * <p>Staged joins are not visible to dispatch. The hub applies them with {@link #join()} once
 * the subscription has passed recursion checking, and drops them otherwise.
 *
 * @param <T> handler type
 */
public final class Listeners<T> {

    private final Registry registry;
    private final ConstructionFrame frame;
    private final ExclusivityCell<T> cell;
    private final List<Membership> staged = new ArrayList<>();

    public Listeners(Registry registry, ConstructionFrame frame, ExclusivityCell<T> cell) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.frame = Objects.requireNonNull(frame, "frame cannot be null");
        this.cell = Objects.requireNonNull(cell, "cell cannot be null");
    }

    /**
     * Joins {@code channel} with the default key, i.e. behind the current members.
     */
    public void listen(Channel<? super T> channel) {
        listen(channel, 0);
    }

    /**
     * Joins {@code channel} at the position given by {@code key}.
     */
    public void listen(Channel<? super T> channel, int key) {
        declare(channel);
        staged.add(new ChannelMembership<>(channel, key, cell));
    }

    /**
     * @throws SlotOccupiedException if the slot already holds a handler
     */
    public void fill(Slot<? super T> slot) {
        fillSlot(slot);
    }

    /**
     * @throws SlotOccupiedException if the single already holds a handler
     */
    public void fill(Single<? super T> single) {
        fillSlot(single);
    }

    private void fillSlot(AbstractSlot<? super T> slot) {
        Objects.requireNonNull(slot, "slot cannot be null");
        if (slot.isOccupied()) {
            throw new SlotOccupiedException(slot.name());
        }
        declare(slot);
        staged.add(new SlotMembership<>(slot, cell));
    }

    private void declare(MembershipContainer container) {
        Objects.requireNonNull(container, "container cannot be null");
        if (container.registry() != registry) {
            throw new ForeignRegistryException(container.name());
        }
        registry.recordListen(frame, container.name());
    }

    /**
     * Re-checks every staged join against the current container state.
     *
     * @throws SlotOccupiedException if a staged slot was filled in the meantime
     * @throws IllegalStateException if a staged container is being dispatched
     */
    public void validate() {
        for (Membership membership : staged) {
            membership.validate();
        }
    }

    /**
     * Applies the staged joins in declaration order.
     *
     * @return the containers joined
     */
    public List<MembershipContainer> join() {
        List<MembershipContainer> joined = new ArrayList<>(staged.size());
        for (Membership membership : staged) {
            membership.join();
            joined.add(membership.container());
        }
        staged.clear();
        return joined;
    }

    public int stagedCount() {
        return staged.size();
    }

    private static void requireIdle(MembershipContainer container) {
        if (container.isDispatching()) {
            throw new IllegalStateException(
                "Cannot join " + container.kind().name().toLowerCase(Locale.ROOT) + " '" + container.name() + "' while it is being dispatched");
        }
    }

    private interface Membership {

        MembershipContainer container();

        void validate();

        void join();
    }

    private record ChannelMembership<S>(Channel<S> container, int key, ExclusivityCell<? extends S> cell)
        implements Membership {

        @Override
        public void validate() {
            requireIdle(container);
        }

        @Override
        public void join() {
            container.insert(key, cell);
        }
    }

    private record SlotMembership<S>(AbstractSlot<S> container, ExclusivityCell<? extends S> cell)
        implements Membership {

        @Override
        public void validate() {
            requireIdle(container);
            if (container.isOccupied()) {
                throw new SlotOccupiedException(container.name());
            }
        }

        @Override
        public void join() {
            container.insert(cell);
        }
    }
}

package io.fullerstack.switchboard.container;

import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.cell.Hold;
import io.fullerstack.switchboard.registry.ChannelKind;
import io.fullerstack.switchboard.registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Ordered multiset of handler cells delivered to in sequence.
 *
 * <p>Members are kept ordered by an integer key. Among members with equal keys a negative
 * key inserts in front of the existing ones and a zero or positive key behind them, so the
 * default key 0 means plain append order. A cell may be a member more than once.
 *
 * <p>Dispatch acquires each member's cell in turn. A member that is already held, e.g. a
 * handler emitting into a channel it listens on without suspending, fails the dispatch with
 * {@link io.fullerstack.switchboard.error.AlreadyBorrowedException}. Structural changes while
 * the channel is being dispatched fail with {@link IllegalStateException}.
 *
 * @param <T> the type handlers are delivered as
 */
public final class Channel<T> implements MembershipContainer {

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    private record Member<T>(int key, ExclusivityCell<? extends T> cell) {
    }

    private final String name;
    private final Registry registry;
    private final List<Member<T>> members = new ArrayList<>();
    private int dispatching;

    /**
     * Standalone channel with no registry.
     */
    public Channel(String name) {
        this(name, null);
    }

    /**
     * @param registry registry the name is declared in, or {@code null} for a standalone channel
     */
    public Channel(String name, Registry registry) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.registry = registry;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.CHANNEL;
    }

    @Override
    public Registry registry() {
        return registry;
    }

    // -------------------- membership --------------------

    public void insert(ExclusivityCell<? extends T> cell) {
        insert(0, cell);
    }

    public void insert(int key, ExclusivityCell<? extends T> cell) {
        Objects.requireNonNull(cell, "cell cannot be null");
        requireIdle("insert into");
        int index = 0;
        while (index < members.size() && precedes(members.get(index).key(), key)) {
            index++;
        }
        members.add(index, new Member<>(key, cell));
    }

    private static boolean precedes(int existing, int key) {
        return key < 0 ? existing < key : existing <= key;
    }

    /**
     * Removes every membership of {@code cell}, compared by identity.
     *
     * @return number of memberships removed
     */
    public int remove(ExclusivityCell<?> cell) {
        Objects.requireNonNull(cell, "cell cannot be null");
        requireIdle("remove from");
        int before = members.size();
        members.removeIf(member -> member.cell() == cell);
        return before - members.size();
    }

    @Override
    public int detach(ExclusivityCell<?> cell) {
        return remove(cell);
    }

    /**
     * Removes the members whose handler matches {@code filter}. The filter runs under an
     * exclusive hold of each member in order; survivors keep their relative order.
     *
     * @return number of memberships removed
     */
    public int removeIf(Predicate<? super T> filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        requireIdle("remove from");
        List<Member<T>> survivors = new ArrayList<>(members.size());
        dispatching++;
        try {
            for (Member<T> member : members) {
                if (!test(member.cell(), filter)) {
                    survivors.add(member);
                }
            }
        } finally {
            dispatching--;
        }
        int removed = members.size() - survivors.size();
        members.clear();
        members.addAll(survivors);
        return removed;
    }

    /**
     * Stable sort of the members by their handlers. Comparisons run under shared holds, so a
     * cell that is a member twice can be compared with itself. Keys travel with their members
     * but no longer determine the order.
     */
    public void sortBy(Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator cannot be null");
        requireIdle("sort");
        dispatching++;
        try {
            members.sort((a, b) -> compare(a.cell(), b.cell(), comparator));
        } finally {
            dispatching--;
        }
    }

    // -------------------- dispatch --------------------

    /**
     * Delivers to every member in order under an exclusive hold.
     */
    public void dispatch(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action cannot be null");
        dispatch((handler, hold) -> action.accept(handler));
    }

    /**
     * Delivers to every member in order under an exclusive hold, passing the hold so the
     * handler can suspend itself before emitting further.
     */
    public void dispatch(BiConsumer<? super T, Hold<?>> action) {
        Objects.requireNonNull(action, "action cannot be null");
        logger.trace("Dispatching '{}' to {} member(s)", name, members.size());
        dispatching++;
        try {
            for (int i = 0; i < members.size(); i++) {
                deliver(members.get(i).cell(), action);
            }
        } finally {
            dispatching--;
        }
    }

    /**
     * Delivers to every member in order under a shared, read-only hold.
     */
    public void dispatchShared(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action cannot be null");
        logger.trace("Dispatching '{}' (shared) to {} member(s)", name, members.size());
        dispatching++;
        try {
            for (int i = 0; i < members.size(); i++) {
                deliverShared(members.get(i).cell(), action);
            }
        } finally {
            dispatching--;
        }
    }

    private static <T, S extends T> void deliver(ExclusivityCell<S> cell, BiConsumer<? super T, Hold<?>> action) {
        cell.dispatch(hold -> {
            action.accept(hold.payload(), hold);
            return null;
        });
    }

    private static <T, S extends T> void deliverShared(ExclusivityCell<S> cell, Consumer<? super T> action) {
        cell.dispatchShared(hold -> {
            action.accept(hold.payload());
            return null;
        });
    }

    private static <T, S extends T> boolean test(ExclusivityCell<S> cell, Predicate<? super T> filter) {
        return cell.dispatch(hold -> filter.test(hold.payload()));
    }

    private static <T, A extends T, B extends T> int compare(
        ExclusivityCell<A> a, ExclusivityCell<B> b, Comparator<? super T> comparator) {
        return a.dispatchShared(left -> b.dispatchShared(right -> comparator.compare(left.payload(), right.payload())));
    }

    // -------------------- queries --------------------

    public int size() {
        return members.size();
    }

    @Override
    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public boolean isDispatching() {
        return dispatching > 0;
    }

    public boolean contains(ExclusivityCell<?> cell) {
        for (Member<T> member : members) {
            if (member.cell() == cell) {
                return true;
            }
        }
        return false;
    }

    /**
     * Snapshot of the member cells in delivery order.
     */
    public List<ExclusivityCell<? extends T>> members() {
        List<ExclusivityCell<? extends T>> snapshot = new ArrayList<>(members.size());
        for (Member<T> member : members) {
            snapshot.add(member.cell());
        }
        return snapshot;
    }

    private void requireIdle(String operation) {
        if (dispatching > 0) {
            throw new IllegalStateException("Cannot " + operation + " channel '" + name + "' while it is being dispatched");
        }
    }

    @Override
    public String toString() {
        return "Channel[" + name + ", members=" + members.size() + "]";
    }
}

package io.fullerstack.switchboard.container;

import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.cell.Hold;
import io.fullerstack.switchboard.error.EmptyRequiredSlotException;
import io.fullerstack.switchboard.error.SlotOccupiedException;
import io.fullerstack.switchboard.registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Container for at most one handler cell. Dispatching an empty container is a wiring bug and
 * always fails with {@link EmptyRequiredSlotException}.
 *
 * @param <T> the type the handler is delivered as
 */
public abstract class AbstractSlot<T> implements MembershipContainer {

    private static final Logger logger = LoggerFactory.getLogger(AbstractSlot.class);

    private final String name;
    private final Registry registry;
    private ExclusivityCell<? extends T> occupant;
    private int dispatching;

    protected AbstractSlot(String name, Registry registry) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.registry = registry;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Registry registry() {
        return registry;
    }

    /**
     * @throws SlotOccupiedException if a cell is already present
     */
    public void insert(ExclusivityCell<? extends T> cell) {
        Objects.requireNonNull(cell, "cell cannot be null");
        requireIdle("fill");
        if (occupant != null) {
            throw new SlotOccupiedException(name);
        }
        occupant = cell;
    }

    /**
     * Takes the occupant out.
     *
     * @throws EmptyRequiredSlotException if there is none
     */
    public ExclusivityCell<? extends T> remove() {
        requireIdle("empty");
        ExclusivityCell<? extends T> removed = requireOccupant();
        occupant = null;
        return removed;
    }

    @Override
    public int detach(ExclusivityCell<?> cell) {
        requireIdle("empty");
        if (occupant != null && occupant == cell) {
            occupant = null;
            return 1;
        }
        return 0;
    }

    /**
     * Delivers to the occupant under an exclusive hold and returns what it produced.
     *
     * @throws EmptyRequiredSlotException if the container is empty
     */
    public <R> R dispatch(Function<? super T, ? extends R> action) {
        Objects.requireNonNull(action, "action cannot be null");
        return dispatch((handler, hold) -> action.apply(handler));
    }

    /**
     * Like {@link #dispatch(Function)}, also passing the hold so the handler can suspend itself.
     */
    public <R> R dispatch(BiFunction<? super T, Hold<?>, ? extends R> action) {
        Objects.requireNonNull(action, "action cannot be null");
        ExclusivityCell<? extends T> cell = requireOccupant();
        logger.trace("Dispatching '{}'", name);
        dispatching++;
        try {
            return deliver(cell, action);
        } finally {
            dispatching--;
        }
    }

    /**
     * Delivers to the occupant under a shared, read-only hold.
     *
     * @throws EmptyRequiredSlotException if the container is empty
     */
    public <R> R dispatchShared(Function<? super T, ? extends R> action) {
        Objects.requireNonNull(action, "action cannot be null");
        ExclusivityCell<? extends T> cell = requireOccupant();
        logger.trace("Dispatching '{}' (shared)", name);
        dispatching++;
        try {
            return deliverShared(cell, action);
        } finally {
            dispatching--;
        }
    }

    private static <T, S extends T, R> R deliver(ExclusivityCell<S> cell, BiFunction<? super T, Hold<?>, ? extends R> action) {
        return cell.dispatch(hold -> action.apply(hold.payload(), hold));
    }

    private static <T, S extends T, R> R deliverShared(ExclusivityCell<S> cell, Function<? super T, ? extends R> action) {
        return cell.dispatchShared(hold -> action.apply(hold.payload()));
    }

    public Optional<ExclusivityCell<? extends T>> occupant() {
        return Optional.ofNullable(occupant);
    }

    public boolean isOccupied() {
        return occupant != null;
    }

    @Override
    public boolean isEmpty() {
        return occupant == null;
    }

    @Override
    public boolean isDispatching() {
        return dispatching > 0;
    }

    private ExclusivityCell<? extends T> requireOccupant() {
        if (occupant == null) {
            throw new EmptyRequiredSlotException(name);
        }
        return occupant;
    }

    private void requireIdle(String operation) {
        if (dispatching > 0) {
            throw new IllegalStateException("Cannot " + operation + " " + kind().name().toLowerCase() + " '" + name + "' while it is being dispatched");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + (occupant == null ? ", empty" : ", " + occupant) + "]";
    }
}

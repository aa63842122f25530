package io.fullerstack.switchboard;

import io.fullerstack.switchboard.cell.DispatchContext;
import io.fullerstack.switchboard.cell.ExclusivityCell;
import io.fullerstack.switchboard.config.SwitchboardConfig;
import io.fullerstack.switchboard.container.Channel;
import io.fullerstack.switchboard.container.MembershipContainer;
import io.fullerstack.switchboard.container.Single;
import io.fullerstack.switchboard.container.Slot;
import io.fullerstack.switchboard.error.EmptyRequiredSlotException;
import io.fullerstack.switchboard.error.NotSubscribedException;
import io.fullerstack.switchboard.export.GraphvizExporter;
import io.fullerstack.switchboard.registry.ChannelKind;
import io.fullerstack.switchboard.registry.ConstructionFrame;
import io.fullerstack.switchboard.registry.HandlerIdentity;
import io.fullerstack.switchboard.registry.Registry;
import io.fullerstack.switchboard.registry.SubscriptionPolicy;
import io.fullerstack.switchboard.subscriber.Emitters;
import io.fullerstack.switchboard.subscriber.Listeners;
import io.fullerstack.switchboard.subscriber.Subscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Entry point of a switchboard: declares channels, slots and singles, subscribes handlers to
 * them and unsubscribes them again.
 *
 * <p>A hub owns one {@link Registry} and one {@link DispatchContext}. Every handler it
 * subscribes is wrapped in an {@link ExclusivityCell} sharing that context, so handlers may
 * re-enter each other through suspension. Subscribing runs these steps:
 * <ol>
 *   <li>open a construction frame for the subscriber's identity</li>
 *   <li>{@link Subscriber#create} builds the handler, declaring what it emits into</li>
 *   <li>{@link Subscriber#listen} declares what it listens on; joins are staged</li>
 *   <li>staged slot fills are checked against current occupancy</li>
 *   <li>the registry folds the frame, rejecting any recursion</li>
 *   <li>the staged joins are applied</li>
 * </ol>
 * A failure at any step leaves every container and the graph as they were.
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * Hub hub = new Hub("ingest");
 * Channel&lt;Sink&gt; raw = hub.channel("raw");
 * Channel&lt;Sink&gt; parsed = hub.channel("parsed");
 * hub.subscribe(new Parser(raw, parsed));
 * hub.verifyWiring();
 * raw.dispatch(sink -&gt; sink.accept(bytes));
 * </pre>
 *
 * <p>Not thread-safe; a hub and everything it creates belong to one thread.
 */
public final class Hub {

    private static final Logger logger = LoggerFactory.getLogger(Hub.class);

    private static final String DEFAULT_NAME = "hub";

    private final String name;
    private final SwitchboardConfig config;
    private final Registry registry;
    private final DispatchContext context = new DispatchContext();
    private final Map<String, MembershipContainer> containers = new TreeMap<>();
    private final Map<ExclusivityCell<?>, List<MembershipContainer>> memberships = new IdentityHashMap<>();

    public Hub() {
        this(DEFAULT_NAME);
    }

    public Hub(String name) {
        this(name, SwitchboardConfig.forHub(name));
    }

    public Hub(String name, SwitchboardConfig config) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        SubscriptionPolicy policy =
            config.getEnum(SwitchboardConfig.POLICY, SubscriptionPolicy.class, SubscriptionPolicy.PER_INSTANCE);
        this.registry = new Registry(policy);
        logger.debug("Created hub '{}' ({}, policy={})", name, config.context(), policy.key());
    }

    // -------------------- declaration --------------------

    public <T> Channel<T> channel(String name) {
        return register(new Channel<>(name, registry));
    }

    public <T> Slot<T> slot(String name) {
        return register(new Slot<>(name, registry));
    }

    public <T> Single<T> single(String name) {
        return register(new Single<>(name, registry));
    }

    private <C extends MembershipContainer> C register(C container) {
        registry.declareChannel(container.name(), container.kind());
        containers.put(container.name(), container);
        return container;
    }

    // -------------------- subscription --------------------

    /**
     * Builds the subscriber's handler and wires it in.
     *
     * @return the cell the handler was placed in, the token for {@link #unsubscribe}
     * @throws io.fullerstack.switchboard.error.RecursionDetectedException if the wiring would let a dispatch reach itself
     * @throws io.fullerstack.switchboard.error.SlotOccupiedException      if a slot or single to fill is taken
     * @throws IllegalStateException                                        if a container to join is being dispatched
     */
    public <T> ExclusivityCell<T> subscribe(Subscriber<T> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        HandlerIdentity identity = subscriber.identity();
        ConstructionFrame frame = registry.beginSubscription(identity);
        ExclusivityCell<T> cell;
        Listeners<T> listeners;
        try {
            T handler = subscriber.create(new Emitters(registry, frame));
            Objects.requireNonNull(handler, () -> identity + " created a null handler");
            cell = new ExclusivityCell<>(handler, context, identity);
            listeners = new Listeners<>(registry, frame, cell);
            subscriber.listen(listeners);
            listeners.validate();
        } catch (RuntimeException e) {
            registry.abandonSubscription(frame);
            throw e;
        }
        registry.endSubscription(frame);
        memberships.put(cell, listeners.join());
        logger.debug("Subscribed {} to {}", identity, frame.listens());
        return cell;
    }

    /**
     * Removes the cell from every container it joined. Graph edges contributed by the
     * subscription stay in place.
     *
     * @throws NotSubscribedException if the cell is not subscribed to this hub
     * @throws IllegalStateException  if one of its containers is being dispatched
     */
    public void unsubscribe(ExclusivityCell<?> cell) {
        Objects.requireNonNull(cell, "cell cannot be null");
        List<MembershipContainer> joined = memberships.get(cell);
        if (joined == null) {
            throw new NotSubscribedException("unable to unsubscribe non-subscribed item: " + cell);
        }
        for (MembershipContainer container : joined) {
            if (container.isDispatching()) {
                throw new IllegalStateException(
                    "Cannot unsubscribe " + cell + " while '" + container.name() + "' is being dispatched");
            }
        }
        memberships.remove(cell);
        int removed = 0;
        for (MembershipContainer container : joined) {
            removed += container.detach(cell);
        }
        logger.debug("Unsubscribed {} ({} membership(s) removed)", cell.identity(), removed);
    }

    public boolean isSubscribed(ExclusivityCell<?> cell) {
        return memberships.containsKey(cell);
    }

    public int subscriptionCount() {
        return memberships.size();
    }

    // -------------------- verification & diagnostics --------------------

    /**
     * Checks that every slot is filled. Singles may stay empty.
     *
     * @throws EmptyRequiredSlotException naming every empty slot
     */
    public void verifyWiring() {
        List<String> empty = new ArrayList<>();
        for (MembershipContainer container : containers.values()) {
            if (container.kind() == ChannelKind.SLOT && container.isEmpty()) {
                empty.add(container.name());
            }
        }
        if (!empty.isEmpty()) {
            throw new EmptyRequiredSlotException(empty);
        }
    }

    public GraphvizExporter exporter() {
        return new GraphvizExporter(
            registry,
            config.getString(SwitchboardConfig.GRAPH_NAME, "Hub"),
            config.getString(SwitchboardConfig.RANKDIR, "LR"));
    }

    public Optional<MembershipContainer> container(String name) {
        return Optional.ofNullable(containers.get(name));
    }

    public Collection<MembershipContainer> containers() {
        return Collections.unmodifiableCollection(containers.values());
    }

    public Registry registry() {
        return registry;
    }

    public DispatchContext context() {
        return context;
    }

    public SwitchboardConfig config() {
        return config;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "Hub[" + name + ", containers=" + containers.size() + ", subscriptions=" + memberships.size() + "]";
    }
}

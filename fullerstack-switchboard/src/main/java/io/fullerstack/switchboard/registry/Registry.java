package io.fullerstack.switchboard.registry;

import io.fullerstack.switchboard.error.DuplicateChannelNameException;
import io.fullerstack.switchboard.error.NoActiveFrameException;
import io.fullerstack.switchboard.error.RecursionDetectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Owner of channel names, construction frames and the reachability graph.
 *
 * <p>The registry is consulted once per subscription and never while dispatching:
 * <ol>
 *   <li>{@link #beginSubscription} opens a {@link ConstructionFrame}</li>
 *   <li>{@link #recordListen} / {@link #recordEmit} fill it</li>
 *   <li>{@link #endSubscription} stages the frame's listen &times; emit edges on a scratch copy
 *       of the graph, checks the whole copy for cycles and only then commits it together with
 *       the channel membership records</li>
 * </ol>
 * A rejected subscription leaves no trace: the graph, the channel records and the frame stack
 * are exactly as they were before {@code beginSubscription}.
 *
 * <p>Frames nest, so a handler may subscribe further handlers while it is being created.
 * Declarations always go to the innermost open frame.
 *
 * <p>Not thread-safe. One registry belongs to one hub.
 */
public final class Registry {

    private static final Logger logger = LoggerFactory.getLogger(Registry.class);

    private final SubscriptionPolicy policy;
    private final Map<String, ChannelRecord> channels = new TreeMap<>();
    private final Deque<ConstructionFrame> frames = new ArrayDeque<>();
    private final Set<String> foldedKinds = new HashSet<>();
    private ReachabilityGraph graph = new ReachabilityGraph();

    public Registry() {
        this(SubscriptionPolicy.PER_INSTANCE);
    }

    public Registry(SubscriptionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    public SubscriptionPolicy policy() {
        return policy;
    }

    // -------------------- declaration --------------------

    /**
     * Declares a name with the given multiplicity.
     *
     * @throws DuplicateChannelNameException if the name is already declared
     */
    public void declareChannel(String name, ChannelKind kind) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        if (channels.containsKey(name)) {
            throw new DuplicateChannelNameException(name);
        }
        channels.put(name, new ChannelRecord(name, kind));
        graph.addNode(name);
        logger.debug("Declared {} '{}'", kind.name().toLowerCase(), name);
    }

    public boolean isDeclared(String name) {
        return channels.containsKey(name);
    }

    // -------------------- construction frames --------------------

    public ConstructionFrame beginSubscription(HandlerIdentity identity) {
        ConstructionFrame frame = new ConstructionFrame(identity);
        frames.push(frame);
        return frame;
    }

    /**
     * Records a listen declaration on the innermost open frame.
     */
    public void recordListen(String channel) {
        recordListen(activeFrame(), channel);
    }

    /**
     * Records an emit declaration on the innermost open frame.
     */
    public void recordEmit(String channel) {
        recordEmit(activeFrame(), channel);
    }

    public void recordListen(ConstructionFrame frame, String channel) {
        requireInnermost(frame);
        requireDeclared(channel);
        frame.listen(channel);
    }

    public void recordEmit(ConstructionFrame frame, String channel) {
        requireInnermost(frame);
        requireDeclared(channel);
        frame.emit(channel);
    }

    /**
     * Folds the frame into the graph and closes it.
     *
     * @throws RecursionDetectedException if the folded graph would contain a cycle; nothing is
     *                                    committed in that case
     */
    public void endSubscription(ConstructionFrame frame) {
        requireInnermost(frame);
        try {
            fold(frame);
        } finally {
            frames.pop();
            frame.close();
        }
    }

    /**
     * Closes the frame without folding anything into the graph.
     */
    public void abandonSubscription(ConstructionFrame frame) {
        requireInnermost(frame);
        frames.pop();
        frame.close();
        logger.debug("Abandoned subscription of {}", frame.identity());
    }

    public boolean hasOpenFrame() {
        return !frames.isEmpty();
    }

    private void fold(ConstructionFrame frame) {
        HandlerIdentity identity = frame.identity();
        if (policy == SubscriptionPolicy.PER_KIND && foldedKinds.contains(identity.key())) {
            logger.debug("Collapsed repeated subscription of {}", identity);
            return;
        }

        ReachabilityGraph candidate = graph.copy();
        for (String from : frame.listens()) {
            int source = candidate.addNode(from);
            for (String to : frame.emits()) {
                candidate.addEdge(source, candidate.addNode(to));
            }
        }

        Optional<List<String>> cycle = CycleDetector.findCycle(candidate);
        if (cycle.isPresent()) {
            RecursionDetectedException error =
                new RecursionDetectedException(identity, cycle.get(), attribute(cycle.get(), frame));
            logger.warn("Rejected subscription: {}", error.getMessage());
            throw error;
        }

        graph = candidate;
        for (String channel : frame.listens()) {
            channels.get(channel).addListener(identity);
        }
        for (String channel : frame.emits()) {
            channels.get(channel).addEmitter(identity);
        }
        foldedKinds.add(identity.key());
        logger.debug("Subscription folded: {} listens={} emits={}", identity, frame.listens(), frame.emits());
    }

    /**
     * Names the handlers responsible for each hop of a cycle: those listening on a channel and
     * emitting into the next. The frame under validation counts as if it were committed.
     */
    private List<Hop> attribute(List<String> chain, ConstructionFrame frame) {
        List<Hop> hops = new ArrayList<>(chain.size() + 1);
        for (int i = 0; i < chain.size(); i++) {
            String from = chain.get(i);
            String to = chain.get((i + 1) % chain.size());
            SortedSet<HandlerIdentity> responsible = new TreeSet<>(channels.get(from).listeners());
            if (frame.listens().contains(from)) {
                responsible.add(frame.identity());
            }
            Set<HandlerIdentity> emitting = new HashSet<>(channels.get(to).emitters());
            if (frame.emits().contains(to)) {
                emitting.add(frame.identity());
            }
            responsible.retainAll(emitting);
            hops.add(new Hop(from, new ArrayList<>(responsible)));
        }
        hops.add(new Hop(chain.get(0), List.of()));
        return hops;
    }

    private ConstructionFrame activeFrame() {
        ConstructionFrame frame = frames.peek();
        if (frame == null) {
            throw new NoActiveFrameException("channel declaration outside of a subscription context");
        }
        return frame;
    }

    private void requireInnermost(ConstructionFrame frame) {
        Objects.requireNonNull(frame, "frame cannot be null");
        if (!frame.isOpen() || frames.peek() != frame) {
            throw new NoActiveFrameException(
                "construction frame of " + frame.identity() + " is not the active subscription context");
        }
    }

    private void requireDeclared(String channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        if (!channels.containsKey(channel)) {
            throw new IllegalArgumentException("Undeclared channel: " + channel);
        }
    }

    // -------------------- queries --------------------

    /**
     * Declared names in sorted order.
     */
    public List<String> channels() {
        return List.copyOf(channels.keySet());
    }

    public Optional<ChannelRecord> record(String name) {
        return Optional.ofNullable(channels.get(name));
    }

    public ChannelKind kind(String name) {
        requireDeclared(name);
        return channels.get(name).kind();
    }

    public List<ChannelRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(channels.values()));
    }

    public List<Edge> edges() {
        return graph.edges();
    }

    /**
     * Whether a dispatch on {@code from} can transitively lead to a dispatch on {@code to}.
     */
    public boolean reaches(String from, String to) {
        requireDeclared(from);
        requireDeclared(to);
        return graph.reaches(graph.handle(from).getAsInt(), graph.handle(to).getAsInt());
    }

    public boolean isAcyclic() {
        return CycleDetector.findCycle(graph).isEmpty();
    }

    @Override
    public String toString() {
        return "Registry[channels=" + channels.size() + ", " + graph + ", policy=" + policy.key() + "]";
    }
}

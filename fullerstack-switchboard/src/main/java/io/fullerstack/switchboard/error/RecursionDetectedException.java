package io.fullerstack.switchboard.error;

import io.fullerstack.switchboard.registry.HandlerIdentity;
import io.fullerstack.switchboard.registry.Hop;

import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when closing a subscription would make the reachability graph cyclic.
 *
 * <p>Carries the full channel chain and, for every hop, the handlers that listen on one
 * channel and emit into the next, so the loop is diagnosable from the message alone:
 * <pre>
 * found a recursion during subscription of Y: [X]a -&gt; [Y]b -&gt; a
 * </pre>
 */
public class RecursionDetectedException extends SwitchboardException {

    private final HandlerIdentity subscriber;
    private final List<String> chain;
    private final List<Hop> hops;

    public RecursionDetectedException(HandlerIdentity subscriber, List<String> chain, List<Hop> hops) {
        super("found a recursion during subscription of " + subscriber.displayName() + ": " + render(hops));
        this.subscriber = subscriber;
        this.chain = List.copyOf(chain);
        this.hops = List.copyOf(hops);
    }

    private static String render(List<Hop> hops) {
        StringBuilder sb = new StringBuilder();
        for (Hop hop : hops) {
            if (sb.length() > 0) sb.append(" -> ");
            sb.append(hop.render());
        }
        return sb.toString();
    }

    /**
     * The handler whose subscription was rejected.
     */
    public HandlerIdentity subscriber() {
        return subscriber;
    }

    /**
     * Channels of the cycle, each once, starting at the first in name order along the path.
     */
    public List<String> chain() {
        return chain;
    }

    /**
     * {@link #chain()} with its first channel appended again to close the loop.
     */
    public List<String> closedChain() {
        List<String> closed = new ArrayList<>(chain);
        closed.add(chain.get(0));
        return closed;
    }

    /**
     * One hop per element of {@link #closedChain()}.
     */
    public List<Hop> hops() {
        return hops;
    }
}

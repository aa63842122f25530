package io.fullerstack.switchboard.registry;

import java.util.List;

/**
 * One step of a reported recursion chain: the channel, and the handlers that listen on it
 * and emit into the next channel of the chain. The closing step carries no handlers.
 */
public record Hop(String channel, List<HandlerIdentity> handlers) {

    public Hop {
        handlers = List.copyOf(handlers);
    }

    /**
     * Renders as {@code [H1,H2]channel}, or just {@code channel} when no handler is attributed.
     */
    public String render() {
        if (handlers.isEmpty()) {
            return channel;
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < handlers.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(handlers.get(i).displayName());
        }
        return sb.append(']').append(channel).toString();
    }

    @Override
    public String toString() {
        return render();
    }
}

package io.fullerstack.switchboard.subscriber;

import io.fullerstack.switchboard.registry.HandlerIdentity;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Recipe for one handler: how to build it and where it listens.
 *
 * <p>A hub calls {@link #create} first, inside an open construction frame, so every container
 * the handler obtains through {@link Emitters} is recorded as something it emits into. Then it
 * calls {@link #listen} with the wrapped handler so the subscriber can join channels and fill
 * slots. Nothing becomes visible to dispatch before the hub has checked that the resulting
 * wiring is free of recursion.
 *
 * <pre>
 * class Doubler implements Subscriber&lt;IntSink&gt; {
 *     public IntSink create(Emitters emitters) {
 *         Channel&lt;IntSink&gt; out = emitters.channel(doubled);
 *         return value -&gt; out.dispatch(sink -&gt; sink.accept(value * 2));
 *     }
 *     public void listen(Listeners&lt;IntSink&gt; listeners) {
 *         listeners.listen(numbers);
 *     }
 * }
 * </pre>
 *
 * @param <T> handler type
 */
public interface Subscriber<T> {

    /**
     * Identity reported in diagnostics; defaults to the subscriber's class.
     */
    default HandlerIdentity identity() {
        return HandlerIdentity.of(getClass());
    }

    /**
     * Builds the handler, declaring every container it emits into.
     */
    T create(Emitters emitters);

    /**
     * Declares every container the handler listens on.
     */
    void listen(Listeners<T> listeners);

    /**
     * Subscriber assembled from functions.
     */
    static <T> Subscriber<T> of(HandlerIdentity identity, Function<Emitters, T> factory, Consumer<Listeners<T>> listening) {
        return new FunctionalSubscriber<>(identity, factory, listening);
    }
}

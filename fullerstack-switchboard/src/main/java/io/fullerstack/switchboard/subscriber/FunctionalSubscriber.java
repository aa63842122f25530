package io.fullerstack.switchboard.subscriber;

import io.fullerstack.switchboard.registry.HandlerIdentity;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link Subscriber} backed by a factory function and a listening callback.
 * <p>
 * < p >The identity is supplied explicitly, since lambdas have no meaningful class name:
 * < pre >
 * hub.subscribe ( Subscriber.of (
 *   HandlerIdentity.of ( "Logger" ),
 *   emitters -&gt; new Logger (),
 *   listeners -&gt; listeners.listen ( events )
 * ) );
 * </pre >
 *
 * @param < T > handler type
 */
final class FunctionalSubscriber < T > implements Subscriber < T > {

  private final HandlerIdentity                 identity;
  private final Function < Emitters, T >        factory;
  private final Consumer < Listeners < T > >    listening;

  FunctionalSubscriber ( HandlerIdentity identity, Function < Emitters, T > factory, Consumer < Listeners < T > > listening ) {
    this.identity = Objects.requireNonNull ( identity, "Subscriber identity cannot be null" );
    this.factory = Objects.requireNonNull ( factory, "Handler factory cannot be null" );
    this.listening = Objects.requireNonNull ( listening, "Listening callback cannot be null" );
  }

  @Override
  public HandlerIdentity identity () {
    return identity;
  }

  @Override
  public T create ( Emitters emitters ) {
    return factory.apply ( emitters );
  }

  @Override
  public void listen ( Listeners < T > listeners ) {
    listening.accept ( listeners );
  }

  @Override
  public String toString () {
    return "Subscriber[" + identity + "]";
  }
}

package io.fullerstack.switchboard.cell;

import io.fullerstack.switchboard.error.AlreadyBorrowedException;
import io.fullerstack.switchboard.error.NotInContextException;
import io.fullerstack.switchboard.error.UnexpectedItemException;
import io.fullerstack.switchboard.registry.HandlerIdentity;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single-owner access cell around one payload.
 * <p>
 * < p >A dispatch acquires the cell, runs a function with a {@link Hold} and releases the
 * cell again, restoring the previous {@link AccessState} even if the function throws.
 * Re-entering the cell from inside that function fails with
 * {@link AlreadyBorrowedException}, unless the running dispatch first gives up its hold with
 * {@link #suspend(Hold, Supplier)}.
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * DispatchContext context = new DispatchContext ();
 * ExclusivityCell&lt;Counter&gt; cell = ExclusivityCell.of ( new Counter (), context );
 * cell.dispatch ( hold -&gt; {
 *   hold.payload ().increment ();
 *   return hold.suspend ( () -&gt; cell.dispatch ( inner -&gt; inner.payload ().value () ) );
 * } );
 * </pre >
 *
 * @param < T > payload type
 */
public final class ExclusivityCell < T > {

  private final T               payload;
  private final DispatchContext context;
  private final HandlerIdentity identity;
  private       AccessState     state = AccessState.FREE;

  /**
   * @param payload  the guarded value
   * @param context  dispatch context shared with every cell this one may re-enter
   * @param identity identity used in diagnostics, or {@code null} for an anonymous cell
   */
  public ExclusivityCell ( T payload, DispatchContext context, HandlerIdentity identity ) {
    this.payload = Objects.requireNonNull ( payload, "payload cannot be null" );
    this.context = Objects.requireNonNull ( context, "context cannot be null" );
    this.identity = identity;
  }

  public static < T > ExclusivityCell < T > of ( T payload, DispatchContext context ) {
    return new ExclusivityCell <> ( payload, context, null );
  }

  /**
   * Runs {@code function} with exclusive access.
   *
   * @throws AlreadyBorrowedException if the cell is held in any way
   */
  public < R > R dispatch ( Function < ? super Hold < T >, ? extends R > function ) {
    return acquire ( AccessKind.EXCLUSIVE, function );
  }

  /**
   * Runs {@code function} with shared, read-only access.
   *
   * @throws AlreadyBorrowedException if the cell is held exclusively
   */
  public < R > R dispatchShared ( Function < ? super Hold < T >, ? extends R > function ) {
    return acquire ( AccessKind.SHARED, function );
  }

  private < R > R acquire ( AccessKind kind, Function < ? super Hold < T >, ? extends R > function ) {
    Objects.requireNonNull ( function, "function cannot be null" );
    context.checkThread ();
    if ( !state.admits ( kind ) ) {
      throw new AlreadyBorrowedException (
        "unable to borrow " + label () + " for " + kind.name ().toLowerCase () + " access: cell is " + state
      );
    }
    Hold < T > hold = new Hold <> ( this, kind );
    state = state.acquire ( kind );
    context.push ( hold );
    try {
      return function.apply ( hold );
    } finally {
      context.pop ( hold );
      hold.status ( Hold.Status.RELEASED );
      state = state.release ( kind );
    }
  }

  /**
   * Gives up {@code hold} while {@code body} runs, so that the body may dispatch on this cell
   * again, then takes the hold back. The hold is restored even if the body throws.
   *
   * @throws NotInContextException   if nothing is being dispatched, or the hold is already suspended
   * @throws UnexpectedItemException if the hold belongs to another cell or is not the innermost one
   */
  public < R > R suspend ( Hold < ? > hold, Supplier < R > body ) {
    Objects.requireNonNull ( hold, "hold cannot be null" );
    Objects.requireNonNull ( body, "body cannot be null" );
    context.checkThread ();
    if ( context.isEmpty () ) {
      throw new NotInContextException ( "unable to suspend " + label () + ": no dispatch in progress" );
    }
    if ( hold.cell () != this ) {
      throw new UnexpectedItemException (
        "unable to suspend " + label () + " with a hold on " + hold.cell ().label ()
      );
    }
    if ( context.top () != hold ) {
      throw new UnexpectedItemException (
        "unable to suspend " + label () + ": its hold is not the innermost dispatch"
      );
    }
    if ( hold.isSuspended () ) {
      throw new NotInContextException ( "unable to suspend " + label () + ": already suspended" );
    }
    AccessKind kind = hold.kind ();
    state = state.release ( kind );
    hold.status ( Hold.Status.SUSPENDED );
    try {
      return body.get ();
    } finally {
      state = state.acquire ( kind );
      hold.status ( Hold.Status.ACTIVE );
    }
  }

  public void suspend ( Hold < ? > hold, Runnable body ) {
    Objects.requireNonNull ( body, "body cannot be null" );
    suspend ( hold, () -> {
      body.run ();
      return null;
    } );
  }

  public AccessState state () {
    return state;
  }

  public boolean isFree () {
    return state instanceof AccessState.Free;
  }

  /**
   * Identity of the handler in this cell, or {@code null} for an anonymous cell.
   */
  public HandlerIdentity identity () {
    return identity;
  }

  public DispatchContext context () {
    return context;
  }

  T payload () {
    return payload;
  }

  String label () {
    return identity != null ? identity.displayName () : payload.getClass ().getSimpleName ();
  }

  @Override
  public String toString () {
    return "ExclusivityCell[" + label () + ", " + state + "]";
  }
}

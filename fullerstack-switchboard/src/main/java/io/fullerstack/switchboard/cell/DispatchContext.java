package io.fullerstack.switchboard.cell;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of the holds of every dispatch currently in progress, innermost on top.
 * <p>
 * < p >One context is shared by all cells that can re-enter each other, normally every cell
 * created by one hub. Suspension is only legal for the hold on top of the stack, which keeps
 * suspends strictly nested inside dispatches.
 * <p>
 * < p >A context is confined to the first thread that dispatches through it. Use from any
 * other thread fails fast with {@link IllegalStateException}.
 */
public final class DispatchContext {

  private final Deque < Hold < ? > > stack = new ArrayDeque <> ();
  private       Thread               owner;

  void push ( Hold < ? > hold ) {
    checkThread ();
    stack.push ( hold );
  }

  void pop ( Hold < ? > hold ) {
    checkThread ();
    Hold < ? > top = stack.peek ();
    if ( top != hold ) {
      throw new IllegalStateException ( "Dispatch context out of order: expected " + hold + " on top, found " + top );
    }
    stack.pop ();
  }

  /**
   * The innermost hold, or {@code null} if nothing is being dispatched.
   */
  public Hold < ? > top () {
    return stack.peek ();
  }

  public boolean isEmpty () {
    return stack.isEmpty ();
  }

  public int depth () {
    return stack.size ();
  }

  /**
   * Binds this context to the calling thread on first use.
   *
   * @throws IllegalStateException if called from a thread other than the owner
   */
  void checkThread () {
    Thread current = Thread.currentThread ();
    if ( owner == null ) {
      owner = current;
    } else if ( owner != current ) {
      throw new IllegalStateException (
        "Dispatch context is confined to thread '" + owner.getName () + "' but was used from '" + current.getName () + "'"
      );
    }
  }

  @Override
  public String toString () {
    return "DispatchContext[depth=" + stack.size () + "]";
  }
}

package io.fullerstack.switchboard.cell;

import io.fullerstack.switchboard.error.NotInContextException;

import java.util.function.Supplier;

/**
 * Capability handed to a function dispatched on an {@link ExclusivityCell}.
 * <p>
 * < p >A hold grants access to the payload for exactly as long as the dispatch runs and is
 * the only way to suspend that dispatch. While suspended, or once the dispatch has returned,
 * {@link #payload()} refuses access, so code that re-enters the cell can never observe the
 * payload through two live references.
 *
 * @param < T > payload type
 */
public final class Hold < T > {

  enum Status { ACTIVE, SUSPENDED, RELEASED }

  private final ExclusivityCell < T > cell;
  private final AccessKind            kind;
  private       Status                status = Status.ACTIVE;

  Hold ( ExclusivityCell < T > cell, AccessKind kind ) {
    this.cell = cell;
    this.kind = kind;
  }

  /**
   * The payload of the held cell.
   *
   * @throws NotInContextException if this hold is suspended or released
   */
  public T payload () {
    if ( status != Status.ACTIVE ) {
      throw new NotInContextException (
        "hold on " + cell.label () + " is " + status.name ().toLowerCase () + "; payload is not accessible"
      );
    }
    return cell.payload ();
  }

  /**
   * Gives up this hold while {@code body} runs, then takes it back.
   *
   * @see ExclusivityCell#suspend(Hold, Supplier)
   */
  public < R > R suspend ( Supplier < R > body ) {
    return cell.suspend ( this, body );
  }

  /**
   * @see ExclusivityCell#suspend(Hold, Runnable)
   */
  public void suspend ( Runnable body ) {
    cell.suspend ( this, body );
  }

  public AccessKind kind () {
    return kind;
  }

  public ExclusivityCell < T > cell () {
    return cell;
  }

  public boolean isActive () {
    return status == Status.ACTIVE;
  }

  public boolean isSuspended () {
    return status == Status.SUSPENDED;
  }

  public boolean isReleased () {
    return status == Status.RELEASED;
  }

  void status ( Status status ) {
    this.status = status;
  }

  @Override
  public String toString () {
    return "Hold[" + cell.label () + ", " + kind + ", " + status + "]";
  }
}

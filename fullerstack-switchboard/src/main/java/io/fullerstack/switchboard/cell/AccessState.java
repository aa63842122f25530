package io.fullerstack.switchboard.cell;

/**
 * Access state of an {@link ExclusivityCell}.
 * <p>
 * < p >Transitions:
 * < pre >
 * Free      --EXCLUSIVE--&gt; Exclusive      --release--&gt; Free
 * Free      --SHARED-----&gt; Shared(1)
 * Shared(n) --SHARED-----&gt; Shared(n + 1)  --release--&gt; Shared(n) or Free
 * </pre >
 * Every other request is refused.
 */
public sealed interface AccessState
  permits AccessState.Free, AccessState.Exclusive, AccessState.Shared {

  Free      FREE      = new Free ();
  Exclusive EXCLUSIVE = new Exclusive ();

  /**
   * Whether a request of the given kind is admitted in this state.
   */
  boolean admits ( AccessKind kind );

  /**
   * State after admitting a request of the given kind.
   *
   * @throws IllegalStateException if the request is not admitted
   */
  AccessState acquire ( AccessKind kind );

  /**
   * State after ending an access of the given kind.
   *
   * @throws IllegalStateException if no such access is in progress
   */
  AccessState release ( AccessKind kind );

  record Free () implements AccessState {

    @Override
    public boolean admits ( AccessKind kind ) {
      return true;
    }

    @Override
    public AccessState acquire ( AccessKind kind ) {
      return kind == AccessKind.EXCLUSIVE ? EXCLUSIVE : new Shared ( 1 );
    }

    @Override
    public AccessState release ( AccessKind kind ) {
      throw new IllegalStateException ( "Cannot release " + kind + " access on a free cell" );
    }

    @Override
    public String toString () {
      return "Free";
    }
  }

  record Exclusive () implements AccessState {

    @Override
    public boolean admits ( AccessKind kind ) {
      return false;
    }

    @Override
    public AccessState acquire ( AccessKind kind ) {
      throw new IllegalStateException ( "Cannot acquire " + kind + " access on an exclusively held cell" );
    }

    @Override
    public AccessState release ( AccessKind kind ) {
      if ( kind != AccessKind.EXCLUSIVE ) {
        throw new IllegalStateException ( "Cannot release " + kind + " access on an exclusively held cell" );
      }
      return FREE;
    }

    @Override
    public String toString () {
      return "Exclusive";
    }
  }

  /**
   * @param readers number of shared accesses in progress, at least one
   */
  record Shared ( int readers ) implements AccessState {

    public Shared {
      if ( readers < 1 ) {
        throw new IllegalArgumentException ( "readers must be positive: " + readers );
      }
    }

    @Override
    public boolean admits ( AccessKind kind ) {
      return kind == AccessKind.SHARED;
    }

    @Override
    public AccessState acquire ( AccessKind kind ) {
      if ( kind != AccessKind.SHARED ) {
        throw new IllegalStateException ( "Cannot acquire " + kind + " access on a shared cell" );
      }
      return new Shared ( readers + 1 );
    }

    @Override
    public AccessState release ( AccessKind kind ) {
      if ( kind != AccessKind.SHARED ) {
        throw new IllegalStateException ( "Cannot release " + kind + " access on a shared cell" );
      }
      return readers == 1 ? FREE : new Shared ( readers - 1 );
    }

    @Override
    public String toString () {
      return "Shared(" + readers + ")";
    }
  }
}

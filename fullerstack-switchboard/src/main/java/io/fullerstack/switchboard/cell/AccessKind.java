package io.fullerstack.switchboard.cell;

/**
 * Kind of access a dispatch requests from an {@link ExclusivityCell}.
 */
public enum AccessKind {

  /** Read-write access; admitted only while the cell is free. */
  EXCLUSIVE,

  /** Read-only access; admitted while the cell is free or already shared. */
  SHARED

}

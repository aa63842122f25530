package io.fullerstack.switchboard.error;

/**
 * Thrown when a cell is dispatched while its current access state does not admit the
 * requested access, e.g. a second exclusive dispatch without an intervening suspend.
 */
public class AlreadyBorrowedException extends SwitchboardException {

    public AlreadyBorrowedException(String message) {
        super(message);
    }
}

package io.fullerstack.switchboard.error;

/**
 * Thrown when unsubscribing a cell the hub does not (or no longer) know about.
 */
public class NotSubscribedException extends SwitchboardException {

    public NotSubscribedException(String message) {
        super(message);
    }
}

package io.fullerstack.switchboard.error;

/**
 * Thrown when a hold is used outside of the dispatch that issued it: suspending with no
 * dispatch in progress, suspending twice, or touching a payload through a released or
 * suspended hold.
 */
public class NotInContextException extends SwitchboardException {

    public NotInContextException(String message) {
        super(message);
    }
}

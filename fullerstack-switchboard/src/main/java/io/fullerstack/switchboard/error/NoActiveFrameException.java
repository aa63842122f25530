package io.fullerstack.switchboard.error;

/**
 * Thrown when a listen or emit declaration is made outside of the construction frame it
 * belongs to, e.g. after {@code create} has returned.
 */
public class NoActiveFrameException extends SwitchboardException {

    public NoActiveFrameException(String message) {
        super(message);
    }
}

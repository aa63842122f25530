package io.fullerstack.switchboard.error;

/**
 * Thrown when a suspend targets something other than the innermost active dispatch.
 */
public class UnexpectedItemException extends SwitchboardException {

    public UnexpectedItemException(String message) {
        super(message);
    }
}

package io.fullerstack.switchboard.error;

/**
 * Base type for every structural wiring fault raised by the switchboard.
 *
 * <p>These are not transient runtime conditions. The shape of a hub is fixed once every
 * handler has been subscribed, so each subclass describes a bug that is detectable during
 * startup or in a test. Callers are expected to let them propagate and abort the
 * dispatch (or the process) rather than recover per call.
 */
public abstract class SwitchboardException extends RuntimeException {

    protected SwitchboardException(String message) {
        super(message);
    }

    protected SwitchboardException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.fullerstack.switchboard.error;

import io.fullerstack.switchboard.registry.HandlerIdentity;
import lombok.Getter;

/**
 * Thrown when one construction frame declares the same listen (or the same emit) twice.
 */
@Getter
public class DuplicateDeclarationException extends SwitchboardException {

    /** Direction of the repeated declaration. */
    public enum Direction { LISTEN, EMIT }

    private final HandlerIdentity handler;
    private final String channel;
    private final Direction direction;

    public DuplicateDeclarationException(HandlerIdentity handler, String channel, Direction direction) {
        super(handler.displayName() + " declared " + direction.name().toLowerCase()
            + " on \"" + channel + "\" more than once");
        this.handler = handler;
        this.channel = channel;
        this.direction = direction;
    }
}

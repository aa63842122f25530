package io.fullerstack.switchboard.error;

import lombok.Getter;

/**
 * Thrown when a subscription declares a container owned by a different registry.
 */
@Getter
public class ForeignRegistryException extends SwitchboardException {

    private final String channel;

    public ForeignRegistryException(String channel) {
        super("registry is different for \"" + channel + "\"");
        this.channel = channel;
    }
}

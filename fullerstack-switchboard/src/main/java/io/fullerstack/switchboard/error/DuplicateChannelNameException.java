package io.fullerstack.switchboard.error;

import lombok.Getter;

/**
 * Thrown when a channel, slot or single is declared under a name the registry already owns.
 */
@Getter
public class DuplicateChannelNameException extends SwitchboardException {

    private final String channel;

    public DuplicateChannelNameException(String channel) {
        super("name is already registered to this registry: \"" + channel + "\"");
        this.channel = channel;
    }
}

package io.fullerstack.switchboard.error;

import lombok.Getter;

/**
 * Thrown when a second node is registered with a slot or single that already holds one.
 */
@Getter
public class SlotOccupiedException extends SwitchboardException {

    private final String slot;

    public SlotOccupiedException(String slot) {
        super("unable to register multiple items simultaneously: \"" + slot + "\"");
        this.slot = slot;
    }
}

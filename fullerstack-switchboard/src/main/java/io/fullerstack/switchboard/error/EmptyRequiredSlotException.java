package io.fullerstack.switchboard.error;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a slot or single with no occupant is dispatched, emptied, or found empty by
 * wiring verification. An unpopulated slot is a structural bug, never a legitimate empty state.
 */
@Getter
public class EmptyRequiredSlotException extends SwitchboardException {

    private final List<String> slots;

    public EmptyRequiredSlotException(String slot) {
        this(List.of(slot));
    }

    public EmptyRequiredSlotException(List<String> slots) {
        super("no node in " + describe(slots));
        this.slots = List.copyOf(slots);
    }

    private static String describe(List<String> slots) {
        if (slots.size() == 1) {
            return "\"" + slots.get(0) + "\"";
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < slots.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('"').append(slots.get(i)).append('"');
        }
        return sb.append(']').toString();
    }
}

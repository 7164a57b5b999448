package io.launchpad.model;

import java.util.EnumSet;
import java.util.Set;

public enum FireworkState {
    WAITING,
    READY,
    RESERVED,
    RUNNING,
    COMPLETED,
    FIZZLED,
    PAUSED,
    DEFUSED,
    ARCHIVED;

    private static final Set<FireworkState> TERMINAL = EnumSet.of(COMPLETED, FIZZLED, ARCHIVED);
    private static final Set<FireworkState> IN_FLIGHT = EnumSet.of(RESERVED, RUNNING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    /**
     * States whose value is fully derived from the parents' states.
     */
    public boolean isDerivable() {
        return this == WAITING || this == READY;
    }

    public static FireworkState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Firework state must not be blank");
        }
        return FireworkState.valueOf(raw.trim().toUpperCase());
    }
}

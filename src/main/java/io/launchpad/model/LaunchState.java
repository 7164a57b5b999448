package io.launchpad.model;

public enum LaunchState {
    RESERVED,
    RUNNING,
    COMPLETED,
    FIZZLED;

    public boolean isActive() {
        return this == RESERVED || this == RUNNING;
    }

    public static LaunchState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Launch state must not be blank");
        }
        return LaunchState.valueOf(raw.trim().toUpperCase());
    }
}

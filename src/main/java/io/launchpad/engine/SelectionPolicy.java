package io.launchpad.engine;

import io.launchpad.model.Firework;

import java.util.Comparator;

/**
 * Built-in orders for picking among READY fireworks. Any other
 * {@code Comparator<Firework>} can be handed to the coordinator instead.
 */
public enum SelectionPolicy {
    /** Insertion order. */
    LOWEST_ID(Comparator.comparingLong(Firework::fwId)),
    /** Highest {@code _priority} first, ties by insertion order. */
    PRIORITY(Comparator.comparingInt(Firework::priority).reversed().thenComparingLong(Firework::fwId));

    private final Comparator<Firework> order;

    SelectionPolicy(Comparator<Firework> order) {
        this.order = order;
    }

    public Comparator<Firework> order() {
        return order;
    }

    public static SelectionPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOWEST_ID;
        }
        return SelectionPolicy.valueOf(raw.trim().toUpperCase().replace('-', '_'));
    }
}

package io.launchpad.engine;

import io.launchpad.model.Firework;
import io.launchpad.model.Launch;

import java.util.Optional;

/**
 * Outcome of a claim. Both parts are absent when nothing was runnable.
 */
public record CheckoutResult(Firework firework, Launch launch) {
    private static final CheckoutResult NONE = new CheckoutResult(null, null);

    public static CheckoutResult claimed(Firework firework, Launch launch) {
        return new CheckoutResult(firework, launch);
    }

    public static CheckoutResult none() {
        return NONE;
    }

    public boolean isEmpty() {
        return firework == null;
    }

    public Optional<Firework> fireworkIfClaimed() {
        return Optional.ofNullable(firework);
    }

    public Optional<Launch> launchIfClaimed() {
        return Optional.ofNullable(launch);
    }
}

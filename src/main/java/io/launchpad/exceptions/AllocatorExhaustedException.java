package io.launchpad.exceptions;

/**
 * A counter would overflow. Allocation fails closed instead of wrapping.
 */
public class AllocatorExhaustedException extends LaunchPadException {

    private final String counter;

    public AllocatorExhaustedException(String counter, long next, long quantity) {
        super("Counter " + counter + " cannot advance by " + quantity + " from " + next);
        this.counter = counter;
    }

    public String getCounter() {
        return counter;
    }
}

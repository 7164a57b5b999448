package io.launchpad.exceptions;

/**
 * Another caller changed a candidate firework between selection and claim.
 * Checkout catches this and selects again.
 */
public class ConcurrentClaimLostException extends LaunchPadException {

    private final long fwId;

    public ConcurrentClaimLostException(long fwId, String observedState) {
        super("Lost claim race for firework " + fwId + ", observed state " + observedState);
        this.fwId = fwId;
    }

    public long getFwId() {
        return fwId;
    }
}

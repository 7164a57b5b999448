package io.launchpad.exceptions;

/**
 * A requested state change is not legal from the entity's current state,
 * for example checking out a firework that is not READY.
 */
public class InvalidTransitionException extends LaunchPadException {

    private final long entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;

    public InvalidTransitionException(long entityId, Enum<?> currentState, Enum<?> requestedState) {
        super(String.format("Invalid transition for %d: %s -> %s", entityId, currentState, requestedState));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public long getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }
}

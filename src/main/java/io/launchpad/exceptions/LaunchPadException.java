package io.launchpad.exceptions;

/**
 * Base type for every failure the store reports to its callers.
 *
 * <p>Each subclass is a distinct outcome so a supervisor can choose between
 * retrying, alerting or aborting without parsing messages.
 */
public class LaunchPadException extends RuntimeException {

    public LaunchPadException(String message) {
        super(message);
    }

    public LaunchPadException(String message, Throwable cause) {
        super(message, cause);
    }
}

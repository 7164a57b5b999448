package io.launchpad.exceptions;

/**
 * The persistence layer failed. The underlying driver exception is the cause.
 */
public class StoreAccessException extends LaunchPadException {

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.launchpad.task;

/**
 * A task ran but reported failure. The launch finishes FIZZLED.
 */
public class TaskExecutionException extends Exception {
    public TaskExecutionException(String message) {
        super(message);
    }
}

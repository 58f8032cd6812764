package io.fleetstate.model;

/**
 * Raised when a task's persisted arguments do not have the shape its kind expects.
 */
public final class CleanupArgsException extends RuntimeException {
    public CleanupArgsException(String message) {
        super(message);
    }

    public CleanupArgsException(String message, Throwable cause) {
        super(message, cause);
    }
}

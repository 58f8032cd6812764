package io.fleetstate.storage;

/**
 * The task store could not be read or written.
 */
public class CleanupStoreException extends RuntimeException {
    public CleanupStoreException(String message) {
        super(message);
    }

    public CleanupStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

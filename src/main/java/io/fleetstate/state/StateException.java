package io.fleetstate.state;

/**
 * Failure reported by the entity-lifecycle layer: store unavailable, transaction conflict or
 * an entity refusing a transition. Subclasses mark the conditions handlers treat specially.
 */
public class StateException extends RuntimeException {
    public StateException(String message) {
        super(message);
    }

    public StateException(String message, Throwable cause) {
        super(message, cause);
    }
}

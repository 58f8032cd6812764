package io.fleetstate.state;

/**
 * The entity is already gone. Cleanup treats this as the work being done.
 */
public class NotFoundException extends StateException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, String id) {
        return new NotFoundException(entity + " \"" + id + "\" not found");
    }
}

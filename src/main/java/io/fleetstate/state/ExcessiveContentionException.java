package io.fleetstate.state;

/**
 * An optimistic update kept losing to concurrent writers.
 */
public class ExcessiveContentionException extends StateException {
    public ExcessiveContentionException(String what, int attempts) {
        super("state changing too quickly; " + what + " gave up after " + attempts + " attempts");
    }
}

package io.fleetstate.state;

public class CharmInUseException extends StateException {
    public CharmInUseException(String charmUrl) {
        super("charm " + charmUrl + " still in use");
    }
}

package io.fleetstate.state;

public interface Action {
    String name();

    ActionStatus status();

    void finish(ActionStatus status, String message);
}

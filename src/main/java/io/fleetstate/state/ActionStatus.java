package io.fleetstate.state;

public enum ActionStatus {
    PENDING,
    RUNNING,
    ABORTING,
    COMPLETED,
    CANCELLED,
    FAILED,
    ABORTED;

    public boolean isFinal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}

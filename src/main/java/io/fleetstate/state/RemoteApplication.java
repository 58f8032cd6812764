package io.fleetstate.state;

public interface RemoteApplication {
    String name();

    void destroy();
}

package io.fleetstate.state;

public interface Application {
    String name();

    void destroy(boolean removeOffers);
}

package io.fleetstate.state;

public interface Charm {
    CharmUrl url();

    /**
     * Marks the charm dying.
     *
     * @throws CharmInUseException when an application still references it
     */
    void destroy();

    void remove();
}

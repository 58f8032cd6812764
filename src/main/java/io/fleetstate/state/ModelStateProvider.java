package io.fleetstate.state;

import io.fleetstate.config.FleetStateConfig;

/**
 * Service-loaded factory for a {@link ModelState} backend, picked by name.
 * Implementations are registered in {@code META-INF/services/io.fleetstate.state.ModelStateProvider}.
 */
public interface ModelStateProvider {
    String name();

    ModelState open(FleetStateConfig config);
}

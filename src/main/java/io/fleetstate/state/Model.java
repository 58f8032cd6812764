package io.fleetstate.state;

import io.fleetstate.model.DestroyModelParams;

public interface Model {
    String uuid();

    void destroy(DestroyModelParams params);
}

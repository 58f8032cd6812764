package io.fleetstate.state;

import java.util.List;

/**
 * Entry point into the entity graph of one model. Lookups throw {@link NotFoundException}
 * for entities that do not exist; enumerations return what exists when they are called.
 */
public interface ModelState {
    String modelUuid();

    Unit unit(String name);

    Machine machine(String id);

    Charm charm(CharmUrl url);

    List<Unit> aliveUnits(String applicationName);

    List<Application> aliveApplications();

    List<RemoteApplication> aliveRemoteApplications();

    List<Machine> allMachines();

    List<String> allModelUuids();

    Model model(String uuid);

    StorageBackend storage();

    List<Action> actionsForReceiver(String receiverId);

    void removeRelationSettings(String prefix);

    void removePayloads(String unitName);

    void removeResourceBlob(String storagePath);
}

package io.fleetstate.cleanup;

import io.fleetstate.config.CleanupSettings;
import io.fleetstate.model.CleanupArgs;
import io.fleetstate.model.CleanupKind;
import io.fleetstate.model.DestroyModelParams;
import io.fleetstate.model.ForceFlag;
import io.fleetstate.model.TeardownFlags;
import io.fleetstate.state.ModelState;
import io.fleetstate.storage.CleanupStore;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Static table from task kind to handler, built once per model. Each route decodes the
 * task's arguments into the kind's typed form before calling the handler.
 */
public final class CleanupRegistry {
    private final Map<CleanupKind, Handler> handlers = new EnumMap<>(CleanupKind.class);
    private final UnitCleanups units;
    private final MachineCleanups machines;
    private final StorageCleanups storage;
    private final ModelCleanups models;

    public CleanupRegistry(ModelState state, CleanupStore store, Clock clock, CleanupSettings settings) {
        ForceCleanupScheduler scheduler = new ForceCleanupScheduler(store, clock, settings.forceTimeout());
        this.storage = new StorageCleanups(state.storage());
        this.units = new UnitCleanups(state, storage, scheduler);
        this.machines = new MachineCleanups(state, storage, units, settings.voteRevokeAttempts());
        this.models = new ModelCleanups(state);
        for (CleanupKind kind : CleanupKind.values()) {
            handlers.put(kind, route(kind));
        }
    }

    /**
     * Runs the handler for {@code kind}.
     *
     * @throws io.fleetstate.model.CleanupArgsException when the arguments do not fit the kind
     * @throws io.fleetstate.state.StateException       when the handler failed and the task must stay
     */
    public Diagnostics dispatch(CleanupKind kind, String prefix, CleanupArgs args) {
        CleanupArgs checked = (args == null ? CleanupArgs.none() : args).requireAtMost(kind.maxArgs());
        return handlers.get(kind).run(prefix, checked);
    }

    public Set<CleanupKind> kinds() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    private Handler route(CleanupKind kind) {
        return switch (kind) {
            case RELATION_SETTINGS -> (prefix, args) -> models.relationSettings(prefix);
            case UNITS_FOR_DYING_APPLICATION -> (prefix, args) ->
                    units.unitsForDyingApplication(prefix, TeardownFlags.decode(args, TeardownFlags.UNIT_LEGACY));
            case CHARM -> (prefix, args) -> models.charm(prefix);
            case DYING_UNIT -> (prefix, args) ->
                    units.dyingUnit(prefix, TeardownFlags.decode(args, TeardownFlags.UNIT_LEGACY));
            case FORCE_DESTROYED_UNIT -> (prefix, args) -> units.forceDestroyedUnit(prefix);
            case FORCE_REMOVE_UNIT -> (prefix, args) -> units.forceRemoveUnit(prefix);
            case REMOVED_UNIT -> (prefix, args) -> units.removedUnit(prefix, ForceFlag.decode(args));
            case APPLICATIONS_FOR_DYING_MODEL -> (prefix, args) -> models.applicationsForDyingModel();
            case DYING_MACHINE -> (prefix, args) -> machines.dyingMachine(prefix, ForceFlag.decode(args));
            case FORCE_DESTROYED_MACHINE -> (prefix, args) -> machines.forceDestroyedMachine(prefix);
            case ATTACHMENTS_FOR_DYING_STORAGE -> (prefix, args) ->
                    storage.attachmentsForDyingStorage(prefix, ForceFlag.decode(args));
            case ATTACHMENTS_FOR_DYING_VOLUME -> (prefix, args) -> storage.attachmentsForDyingVolume(prefix);
            case ATTACHMENTS_FOR_DYING_FILESYSTEM -> (prefix, args) -> storage.attachmentsForDyingFilesystem(prefix);
            case MODELS_FOR_DYING_CONTROLLER -> (prefix, args) ->
                    models.modelsForDyingController(DestroyModelParams.decode(args));
            case MACHINES_FOR_DYING_MODEL -> (prefix, args) -> machines.machinesForDyingModel();
            case DYING_UNIT_RESOURCES -> (prefix, args) -> storage.dyingUnitResources(prefix, ForceFlag.decode(args));
            case RESOURCE_BLOB -> (prefix, args) -> models.resourceBlob(prefix);
            case STORAGE_FOR_DYING_MODEL -> (prefix, args) ->
                    storage.storageForDyingModel(TeardownFlags.decode(args, TeardownFlags.MODEL_STORAGE_LEGACY));
        };
    }

    @FunctionalInterface
    interface Handler {
        Diagnostics run(String prefix, CleanupArgs args);
    }
}

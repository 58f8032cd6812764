package io.fleetstate.cleanup;

import io.fleetstate.model.ForceFlag;
import io.fleetstate.state.ExcessiveContentionException;
import io.fleetstate.state.Machine;
import io.fleetstate.state.ModelState;
import io.fleetstate.state.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Machine teardown. The machine record itself is left in place for the provisioner, which
 * still has to release the underlying instance.
 */
public final class MachineCleanups {
    private static final Logger LOG = LoggerFactory.getLogger(MachineCleanups.class);

    private final ModelState state;
    private final StorageCleanups storage;
    private final UnitCleanups units;
    private final int voteRevokeAttempts;

    public MachineCleanups(ModelState state, StorageCleanups storage, UnitCleanups units, int voteRevokeAttempts) {
        this.state = state;
        this.storage = storage;
        this.units = units;
        this.voteRevokeAttempts = Math.max(1, voteRevokeAttempts);
    }

    /**
     * Releases the storage of a dying machine so it can go on to die.
     */
    public Diagnostics dyingMachine(String machineId, ForceFlag flag) {
        Diagnostics diagnostics = new Diagnostics();
        Machine machine;
        try {
            machine = state.machine(machineId);
        } catch (NotFoundException e) {
            return diagnostics;
        }
        storage.dyingMachineResources(machine, flag.force(), diagnostics);
        return diagnostics;
    }

    /**
     * Destroys everything that depends on a force-destroyed machine: containers (deepest first,
     * each removed once torn down), principal units, storage and controller membership. The
     * machine itself ends up dead with its ports closed.
     */
    public Diagnostics forceDestroyedMachine(String machineId) {
        Diagnostics diagnostics = new Diagnostics();
        MachineTree tree = MachineTree.collect(state, machineId);

        // Upgrade-series locks would block removal of everything below.
        for (String id : tree.topDown()) {
            removeUpgradeSeriesLock(id);
        }

        for (String containerId : tree.containersDeepestFirst()) {
            tearDown(containerId, diagnostics);
            try {
                state.machine(containerId).remove();
            } catch (NotFoundException e) {
                LOG.debug("container {} already removed", containerId);
            }
        }
        tearDown(tree.rootId(), diagnostics);
        return diagnostics;
    }

    /**
     * Sets every machine of a dying model dying, except controllers and containers; containers
     * go with their hosts. Manual machines get a plain destroy since forcing them could leak
     * what runs on them.
     */
    public Diagnostics machinesForDyingModel() {
        for (Machine machine : state.allMachines()) {
            if (machine.isManager() || machine.parentId().isPresent()) {
                continue;
            }
            if (machine.isManual()) {
                machine.destroy();
            } else {
                machine.forceDestroy();
            }
        }
        return Diagnostics.none();
    }

    private void removeUpgradeSeriesLock(String machineId) {
        LOG.info("removing any upgrade series locks for machine {}", machineId);
        try {
            state.machine(machineId).removeUpgradeSeriesLock();
        } catch (NotFoundException e) {
            LOG.debug("no upgrade series lock for machine {}", machineId);
        }
    }

    private void tearDown(String machineId, Diagnostics diagnostics) {
        Machine machine;
        try {
            machine = state.machine(machineId);
        } catch (NotFoundException e) {
            return;
        }
        for (String unitName : machine.principals()) {
            units.obliterate(unitName, true, diagnostics);
        }
        storage.dyingMachineResources(machine, true, diagnostics);
        if (machine.isManager()) {
            if (machine.hasVote()) {
                // Not reflected in the live replica set; forced controller removal is on the user.
                revokeVote(machine);
            }
            machine.removeControllerMembership();
        }

        // The unit cleanups above changed the machine underneath the local copy.
        try {
            machine.refresh();
        } catch (NotFoundException e) {
            return;
        }
        machine.ensureDead();
        machine.removePorts();
    }

    private void revokeVote(Machine machine) {
        for (int attempt = 0; attempt < voteRevokeAttempts; attempt++) {
            if (attempt > 0) {
                machine.refresh();
                if (!machine.hasVote()) {
                    return;
                }
            }
            if (machine.clearVote()) {
                return;
            }
        }
        throw new ExcessiveContentionException("revoking vote of machine " + machine.id(), voteRevokeAttempts);
    }
}

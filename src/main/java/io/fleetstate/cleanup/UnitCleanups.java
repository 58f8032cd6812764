package io.fleetstate.cleanup;

import io.fleetstate.model.CleanupKind;
import io.fleetstate.model.ForceFlag;
import io.fleetstate.model.TeardownFlags;
import io.fleetstate.state.Action;
import io.fleetstate.state.ActionStatus;
import io.fleetstate.state.DependentsRemainException;
import io.fleetstate.state.ModelState;
import io.fleetstate.state.NotFoundException;
import io.fleetstate.state.Relation;
import io.fleetstate.state.RelationUnit;
import io.fleetstate.state.StateException;
import io.fleetstate.state.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Unit teardown: the graceful dying-unit path, its force backstops, and the bookkeeping left
 * behind once a unit is removed.
 */
public final class UnitCleanups {
    private static final Logger LOG = LoggerFactory.getLogger(UnitCleanups.class);
    static final String UNIT_REMOVED_MESSAGE = "unit removed";

    private final ModelState state;
    private final StorageCleanups storage;
    private final ForceCleanupScheduler scheduler;

    public UnitCleanups(ModelState state, StorageCleanups storage, ForceCleanupScheduler scheduler) {
        this.state = state;
        this.storage = storage;
        this.scheduler = scheduler;
    }

    /**
     * Destroys every unit still alive under a dying application. A dying application admits no
     * new units, so the enumeration is complete.
     */
    public Diagnostics unitsForDyingApplication(String applicationName, TeardownFlags flags) {
        for (Unit unit : state.aliveUnits(applicationName)) {
            unit.destroy(flags.destroyStorage(), flags.force());
        }
        return Diagnostics.none();
    }

    /**
     * Lets related units know this one is going, then releases its storage. With force, a
     * backstop that drives the unit to dead is scheduled as well.
     */
    public Diagnostics dyingUnit(String unitName, TeardownFlags flags) {
        Diagnostics diagnostics = new Diagnostics();
        boolean force = flags.force();
        Unit unit;
        try {
            unit = state.unit(unitName);
        } catch (NotFoundException e) {
            return diagnostics;
        }

        List<Relation> relations = List.of();
        try {
            relations = unit.relationsJoined();
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG,
                    "could not get joined relations for unit {} during dying unit cleanup: {}", unitName, e);
        }
        for (Relation relation : relations) {
            RelationUnit relationUnit;
            try {
                relationUnit = relation.unit(unit);
            } catch (NotFoundException e) {
                continue;
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG,
                        "could not get unit relation for unit {} during dying unit cleanup: {}", unitName, e);
                continue;
            }
            try {
                relationUnit.prepareLeaveScope();
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG,
                        "could not prepare to leave scope for relation {} for unit {} during dying unit cleanup: {}",
                        relation.key(), unitName, e);
            }
        }

        if (force) {
            scheduler.schedule(CleanupKind.FORCE_DESTROYED_UNIT, unitName);
        }

        if (flags.destroyStorage()) {
            storage.destroyUnitStorageInstances(unitName, force);
        } else {
            storage.detachUnitStorage(unitName, false, force, diagnostics);
        }
        return diagnostics;
    }

    /**
     * Backstop for a forced unit destroy that did not finish on its own. Subordinates,
     * relation scopes and storage are torn down best-effort; if the unit still cannot die
     * because dependents remain, the task fails and is retried on a later pass.
     */
    public Diagnostics forceDestroyedUnit(String unitName) {
        Diagnostics diagnostics = new Diagnostics();
        Unit unit;
        try {
            unit = state.unit(unitName);
        } catch (NotFoundException e) {
            LOG.debug("no need to force unit to dead {}", unitName);
            return diagnostics;
        }

        for (String subordinateName : unit.subordinateNames()) {
            Unit subordinate;
            try {
                subordinate = state.unit(subordinateName);
            } catch (NotFoundException e) {
                continue;
            } catch (StateException e) {
                diagnostics.warn(LOG, "couldn't get subordinate {} to force destroy: {}", subordinateName, e);
                continue;
            }
            try {
                List<Exception> opErrors = subordinate.destroyWithForce(true);
                if (!opErrors.isEmpty()) {
                    diagnostics.warn(LOG, "errors while destroying subordinate {}: {}", subordinateName, messages(opErrors));
                }
            } catch (StateException e) {
                diagnostics.warn(LOG, "errors while destroying subordinate {}: {}", subordinateName, e);
            }
        }

        try {
            for (Relation relation : unit.relationsInScope()) {
                try {
                    relation.unit(unit).leaveScope();
                } catch (StateException e) {
                    diagnostics.warn(LOG, "unit {} couldn't leave scope of relation {}: {}", unitName, relation.key(), e);
                }
            }
        } catch (StateException e) {
            diagnostics.warn(LOG, "couldn't get in-scope relations for unit {}: {}", unitName, e);
        }

        try {
            storage.forceRemoveUnitStorageAttachments(unitName, diagnostics);
        } catch (StateException e) {
            diagnostics.warn(LOG, "couldn't remove storage attachments for {}: {}", unitName, e);
        }

        try {
            unit.refresh();
        } catch (NotFoundException e) {
            LOG.debug("unit {} went away while forcing it to dead", unitName);
            return diagnostics;
        }
        try {
            unit.ensureDead();
        } catch (DependentsRemainException e) {
            // The subordinates and storage torn down above need time to go away.
            throw e;
        } catch (StateException e) {
            diagnostics.warn(LOG, "couldn't set unit {} dead: {}", unitName, e);
        }

        scheduler.schedule(CleanupKind.FORCE_REMOVE_UNIT, unitName);
        return diagnostics;
    }

    public Diagnostics forceRemoveUnit(String unitName) {
        Diagnostics diagnostics = new Diagnostics();
        Unit unit;
        try {
            unit = state.unit(unitName);
        } catch (NotFoundException e) {
            LOG.debug("no need to force remove unit {}", unitName);
            return diagnostics;
        }
        List<Exception> opErrors = unit.removeWithForce(true);
        if (!opErrors.isEmpty()) {
            diagnostics.warn(LOG, "errors encountered force-removing unit {}: {}", unitName, messages(opErrors));
        }
        return diagnostics;
    }

    /**
     * Cancels the removed unit's unfinished actions and drops its payload records.
     */
    public Diagnostics removedUnit(String unitName, ForceFlag flag) {
        Diagnostics diagnostics = new Diagnostics();
        boolean force = flag.force();
        List<Action> actions = List.of();
        try {
            actions = state.actionsForReceiver(unitName);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG,
                    "could not get unit actions for unit {} during cleanup of removed unit: {}", unitName, e);
        }
        for (Action action : actions) {
            if (action.status().isFinal()) {
                continue;
            }
            try {
                action.finish(ActionStatus.CANCELLED, UNIT_REMOVED_MESSAGE);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG,
                        "could not finish action {} for unit {} during cleanup of removed unit: {}",
                        action.name(), unitName, e);
            }
        }
        try {
            state.removePayloads(unitName);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG,
                    "could not cleanup payload for unit {} during cleanup of removed unit: {}", unitName, e);
        }
        return diagnostics;
    }

    /**
     * Removes a unit and everything it owns outright. Only sane while obliterating the machine
     * it runs on, where an unclean unit shutdown cannot strand anything.
     */
    void obliterate(String unitName, boolean force, Diagnostics diagnostics) {
        Unit unit;
        try {
            unit = state.unit(unitName);
        } catch (NotFoundException e) {
            return;
        }
        try {
            recordAll(diagnostics, unitName, unit.destroyWithForce(force));
        } catch (StateException e) {
            if (!force) {
                throw new StateException("cannot destroy unit \"" + unitName + "\": " + e.getMessage(), e);
            }
            diagnostics.warn(LOG, "while obliterating unit {}: {}", unitName, e);
        }
        try {
            unit.refresh();
        } catch (NotFoundException e) {
            return;
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "while obliterating unit {}: {}", unitName, e);
        }
        try {
            storage.detachUnitStorage(unitName, true, force, diagnostics);
        } catch (StateException e) {
            if (!force) {
                throw new StateException("cannot destroy storage for unit \"" + unitName + "\": " + e.getMessage(), e);
            }
            diagnostics.warn(LOG, "cannot destroy storage for unit {}: {}", unitName, e);
        }
        // Subordinates have no subordinates of their own, so this recursion is one level deep.
        for (String subordinateName : unit.subordinateNames()) {
            try {
                obliterate(subordinateName, force, diagnostics);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "while obliterating unit {}: {}", subordinateName, e);
            }
        }
        try {
            unit.refresh();
        } catch (NotFoundException e) {
            return;
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "while obliterating unit {}: {}", unitName, e);
        }
        try {
            unit.ensureDead();
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "while obliterating unit {}: {}", unitName, e);
        }
        recordAll(diagnostics, unitName, unit.removeWithForce(force));
    }

    private static void recordAll(Diagnostics diagnostics, String unitName, List<Exception> opErrors) {
        for (Exception opError : opErrors) {
            diagnostics.warn(LOG, "while obliterating unit {}: {}", unitName, opError);
        }
    }

    private static List<String> messages(List<Exception> errors) {
        return errors.stream().map(Exception::getMessage).toList();
    }
}

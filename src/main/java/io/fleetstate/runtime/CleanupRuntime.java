package io.fleetstate.runtime;

import io.fleetstate.cleanup.CleanupRegistry;
import io.fleetstate.cleanup.Diagnostics;
import io.fleetstate.config.CleanupSettings;
import io.fleetstate.config.FleetStateConfig;
import io.fleetstate.model.CleanupArgs;
import io.fleetstate.model.CleanupKind;
import io.fleetstate.model.CleanupTask;
import io.fleetstate.observability.AuditLogger;
import io.fleetstate.state.ModelState;
import io.fleetstate.storage.CleanupStore;
import io.fleetstate.storage.CleanupStoreException;
import io.fleetstate.storage.Database;
import io.fleetstate.storage.StoreOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class CleanupRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(CleanupRuntime.class);

    private final FleetStateConfig config;
    private final Database database;
    private final CleanupStore store;
    private final ModelState modelState;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private volatile CleanupSettings settings;
    private volatile CleanupRegistry registry;

    /**
     * @param modelState entity graph the handlers act on; may be {@code null} for a runtime that
     *                   only queues and inspects tasks
     */
    public CleanupRuntime(FleetStateConfig config, ModelState modelState) {
        this(config, modelState, Clock.systemUTC());
    }

    public CleanupRuntime(FleetStateConfig config, ModelState modelState, Clock clock) {
        this.config = config;
        this.database = new Database(config);
        this.store = new CleanupStore(database, clock);
        this.modelState = modelState;
        this.clock = clock;
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                config.namespace(),
                AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile()),
                clock
        );
        this.settings = CleanupSettings.defaults();
    }

    public void init() {
        database.init();
        reloadSettings();
    }

    public CleanupSettings reloadSettings() {
        CleanupSettings loaded = CleanupSettings.load(config.settingsFile());
        this.settings = loaded;
        this.registry = modelState == null ? null : new CleanupRegistry(modelState, store, clock, loaded);
        return loaded;
    }

    public CleanupSettings currentSettings() {
        return settings;
    }

    public CleanupStore store() {
        return store;
    }

    /**
     * Commits {@code ops} together. Callers pass {@link CleanupStore#enqueueOp} results next to
     * their own lifecycle writes so the cleanup exists exactly when the change does.
     */
    public void transact(StoreOp... ops) {
        database.transact(ops);
    }

    public EnqueueOutcome enqueueCleanup(CleanupKind kind, String prefix, CleanupArgs args) {
        return enqueueCleanupAt(CleanupTask.ASAP, kind, prefix, args);
    }

    public EnqueueOutcome enqueueCleanupAt(Instant when, CleanupKind kind, String prefix, CleanupArgs args) {
        CleanupArgs safeArgs = args == null ? CleanupArgs.none() : args;
        String id = store.enqueueAt(when, kind, prefix, safeArgs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("due_at_ms", when.toEpochMilli());
        details.put("args", safeArgs.size());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "cleanup.enqueue",
                resource(kind.wireName(), prefix),
                "queued",
                id,
                details
        ));
        return new EnqueueOutcome(id, kind.wireName(), prefix, when);
    }

    public boolean hasPendingCleanups() {
        return store.hasPending();
    }

    public PendingView pending() {
        return new PendingView(store.countPending(), store.countDue(clock.instant()));
    }

    /**
     * One drain pass over the tasks due now. A failing task is logged and left for the next
     * pass; only a store failure while deleting a finished task ends the pass early.
     *
     * @throws CleanupStoreException when a completed task could not be deleted
     */
    public RunOutcome runCleanup() {
        CleanupRegistry handlers = registry;
        if (handlers == null) {
            throw new IllegalStateException("No model state backend configured; cannot run cleanups");
        }
        String modelUuid = modelState.modelUuid();
        String modelId = modelUuid.length() > 6 ? modelUuid.substring(0, 6) : modelUuid;
        List<CleanupTask> due = store.due(clock.instant(), settings.drainBatchLimit());
        int completed = 0;
        int failed = 0;
        int unknownKind = 0;
        int alreadyRemoved = 0;
        List<String> warnings = new ArrayList<>();
        List<TaskFailure> failures = new ArrayList<>();
        for (CleanupTask task : due) {
            LOG.debug("model {} cleanup: {}", modelId, task.describe());
            Optional<CleanupKind> kind = task.kind();
            if (kind.isEmpty()) {
                unknownKind++;
                String error = "unknown cleanup kind \"" + task.kindName() + "\"";
                LOG.warn("cleanup failed in model {} for {}: {}", modelUuid, task.describe(), error);
                failures.add(new TaskFailure(task.id(), task.kindName(), task.prefix(), error));
                audit(task, "unknown_kind", Map.of("error", error));
                continue;
            }
            Diagnostics diagnostics;
            try {
                diagnostics = handlers.dispatch(kind.get(), task.prefix(), task.args());
            } catch (RuntimeException e) {
                failed++;
                String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                LOG.warn("cleanup failed in model {} for {}: {}", modelUuid, task.describe(), error);
                failures.add(new TaskFailure(task.id(), task.kindName(), task.prefix(), error));
                audit(task, "failed", Map.of("error", error));
                continue;
            }
            boolean removed;
            try {
                removed = store.delete(task.id());
            } catch (CleanupStoreException e) {
                throw new CleanupStoreException("cannot remove empty cleanup document " + task.id(), e);
            }
            if (removed) {
                completed++;
            } else {
                // Another runner finished the same task first.
                alreadyRemoved++;
            }
            for (String warning : diagnostics.warnings()) {
                warnings.add(task.describe() + ": " + warning);
            }
            audit(task, removed ? "completed" : "already_removed", Map.of("warnings", diagnostics.warnings()));
        }
        return new RunOutcome(due.size(), completed, failed, unknownKind, alreadyRemoved, warnings, failures);
    }

    public AuditLogger.IntegrityOutcome verifyAudit() {
        return auditLogger.verify();
    }

    private void audit(CleanupTask task, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "cleanup.run",
                resource(task.kindName(), task.prefix()),
                result,
                task.id(),
                details
        ));
    }

    private static String resource(String kind, String prefix) {
        return "cleanup/" + kind + "/" + (prefix == null ? "" : prefix);
    }

    public record EnqueueOutcome(String cleanupId, String kind, String prefix, Instant dueAt) {
    }

    public record PendingView(long pending, long due) {
    }

    public record TaskFailure(String cleanupId, String kind, String prefix, String error) {
    }

    /**
     * @param due            tasks that were due when the pass started
     * @param completed      tasks whose handler succeeded and whose record this pass deleted
     * @param failed         tasks whose handler failed; they stay pending
     * @param unknownKind    tasks of a kind this build cannot handle; they stay pending
     * @param alreadyRemoved tasks that succeeded but had been deleted by another runner meanwhile
     * @param warnings       force-mode failures stepped over by succeeding handlers
     */
    public record RunOutcome(
            int due,
            int completed,
            int failed,
            int unknownKind,
            int alreadyRemoved,
            List<String> warnings,
            List<TaskFailure> failures
    ) {
    }
}

package io.fleetstate.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A persisted unit of deferred teardown work. Records are immutable: a task is created once
 * and later deleted, never updated.
 *
 * @param id        globally unique id
 * @param kindName  raw persisted kind; may name a kind this build does not know
 * @param prefix    entity identifier interpreted by the handler
 * @param dueAt     earliest execution time; {@code null} for legacy records, which are due now
 * @param argsJson  handler specific arguments as a JSON array, or {@code null}
 * @param createdAt creation time
 */
public record CleanupTask(
        String id,
        String kindName,
        String prefix,
        Instant dueAt,
        String argsJson,
        Instant createdAt
) {
    /** Earliest possible time: a task due at this instant runs on the next pass. */
    public static final Instant ASAP = Instant.EPOCH;

    /**
     * Decodes the persisted arguments. Malformed JSON surfaces here, so it only fails the one
     * task that carries it.
     */
    public CleanupArgs args() {
        return CleanupArgs.fromJson(argsJson);
    }

    public Optional<CleanupKind> kind() {
        return CleanupKind.fromWireName(kindName);
    }

    public boolean isDue(Instant now) {
        return dueAt == null || !dueAt.isAfter(now);
    }

    public String describe() {
        return kindName + "(\"" + prefix + "\")";
    }
}

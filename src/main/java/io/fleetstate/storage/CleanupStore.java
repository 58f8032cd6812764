package io.fleetstate.storage;

import io.fleetstate.model.CleanupArgs;
import io.fleetstate.model.CleanupKind;
import io.fleetstate.model.CleanupTask;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable queue of cleanup tasks. Records are inserted and deleted, never updated.
 */
public final class CleanupStore {
    private static final String SELECT_COLUMNS = "cleanup_id,kind,prefix,due_at_ms,args_json,created_at_ms";

    private final Database database;
    private final Clock clock;

    public CleanupStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Builds an insert of a task that is due immediately, for composition with the caller's own
     * writes in {@link Database#transact(StoreOp...)}.
     */
    public PendingCleanup enqueueOp(CleanupKind kind, String prefix, CleanupArgs args) {
        return enqueueAtOp(CleanupTask.ASAP, kind, prefix, args);
    }

    public PendingCleanup enqueueAtOp(Instant when, CleanupKind kind, String prefix, CleanupArgs args) {
        Objects.requireNonNull(when, "when");
        Objects.requireNonNull(kind, "kind");
        CleanupArgs safeArgs = args == null ? CleanupArgs.none() : args;
        String id = newCleanupId();
        long createdAtMs = clock.millis();
        String argsJson = safeArgs.toJson();
        StoreOp op = conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO cleanups(cleanup_id,kind,prefix,due_at_ms,args_json,created_at_ms) VALUES(?,?,?,?,?,?)")) {
                ps.setString(1, id);
                ps.setString(2, kind.wireName());
                ps.setString(3, prefix == null ? "" : prefix);
                ps.setLong(4, when.toEpochMilli());
                if (argsJson == null) {
                    ps.setNull(5, Types.VARCHAR);
                } else {
                    ps.setString(5, argsJson);
                }
                ps.setLong(6, createdAtMs);
                ps.executeUpdate();
            }
        };
        return new PendingCleanup(id, op);
    }

    public String enqueue(CleanupKind kind, String prefix, CleanupArgs args) {
        PendingCleanup pending = enqueueOp(kind, prefix, args);
        database.transact(pending.op());
        return pending.id();
    }

    public String enqueueAt(Instant when, CleanupKind kind, String prefix, CleanupArgs args) {
        PendingCleanup pending = enqueueAtOp(when, kind, prefix, args);
        database.transact(pending.op());
        return pending.id();
    }

    public boolean hasPending() {
        return countPending() > 0;
    }

    public long countPending() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM cleanups");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new CleanupStoreException("Failed to count cleanups", e);
        }
    }

    public long countDue(Instant now) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(1) FROM cleanups WHERE due_at_ms IS NULL OR due_at_ms<=?")) {
            ps.setLong(1, now.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            throw new CleanupStoreException("Failed to count due cleanups", e);
        }
    }

    /**
     * Tasks eligible at {@code now}: records without a due time, and records due at or before it.
     *
     * @param limit maximum number of records, or 0 for all of them
     */
    public List<CleanupTask> due(Instant now, int limit) {
        String sql = "SELECT " + SELECT_COLUMNS + """
                 FROM cleanups
                WHERE due_at_ms IS NULL OR due_at_ms<=?
                ORDER BY COALESCE(due_at_ms,0), created_at_ms, cleanup_id
                LIMIT ?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, now.toEpochMilli());
            ps.setInt(2, limit <= 0 ? -1 : limit);
            return readTasks(ps);
        } catch (SQLException e) {
            throw new CleanupStoreException("Failed to read due cleanups", e);
        }
    }

    public List<CleanupTask> list(int limit) {
        String sql = "SELECT " + SELECT_COLUMNS + """
                 FROM cleanups
                ORDER BY COALESCE(due_at_ms,0), created_at_ms, cleanup_id
                LIMIT ?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            return readTasks(ps);
        } catch (SQLException e) {
            throw new CleanupStoreException("Failed to list cleanups", e);
        }
    }

    public Optional<CleanupTask> find(String cleanupId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT " + SELECT_COLUMNS + " FROM cleanups WHERE cleanup_id=?")) {
            ps.setString(1, cleanupId);
            List<CleanupTask> rows = readTasks(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (SQLException e) {
            throw new CleanupStoreException("Failed to read cleanup " + cleanupId, e);
        }
    }

    /**
     * Removes a finished task if it is still there.
     *
     * @return false when another runner already removed it
     */
    public boolean delete(String cleanupId) {
        boolean[] removed = new boolean[1];
        database.transact(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM cleanups WHERE cleanup_id=?")) {
                ps.setString(1, cleanupId);
                removed[0] = ps.executeUpdate() > 0;
            }
        });
        return removed[0];
    }

    private List<CleanupTask> readTasks(PreparedStatement ps) throws SQLException {
        List<CleanupTask> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                long dueAtMs = rs.getLong("due_at_ms");
                Instant dueAt = rs.wasNull() ? null : Instant.ofEpochMilli(dueAtMs);
                out.add(new CleanupTask(
                        rs.getString("cleanup_id"),
                        rs.getString("kind"),
                        rs.getString("prefix"),
                        dueAt,
                        rs.getString("args_json"),
                        Instant.ofEpochMilli(rs.getLong("created_at_ms"))
                ));
            }
        }
        return out;
    }

    private static String newCleanupId() {
        return "cln_" + UUID.randomUUID();
    }

    /**
     * An insert that has been prepared but not committed.
     */
    public record PendingCleanup(String id, StoreOp op) {
    }
}

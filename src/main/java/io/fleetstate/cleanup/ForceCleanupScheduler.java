package io.fleetstate.cleanup;

import io.fleetstate.config.FleetStateConfig;
import io.fleetstate.model.CleanupArgs;
import io.fleetstate.model.CleanupKind;
import io.fleetstate.storage.CleanupStore;
import io.fleetstate.storage.CleanupStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Enqueues backstop tasks that finish a forced teardown if the cooperating agents never do.
 */
public final class ForceCleanupScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(ForceCleanupScheduler.class);

    private final CleanupStore store;
    private final Clock clock;
    private final Duration forceTimeout;

    public ForceCleanupScheduler(CleanupStore store, Clock clock, Duration forceTimeout) {
        this.store = store;
        this.clock = clock;
        this.forceTimeout = clamp(forceTimeout);
    }

    public Duration forceTimeout() {
        return forceTimeout;
    }

    /**
     * Schedules {@code kind} for {@code prefix} one force timeout from now, in its own
     * transaction. A backstop that cannot be written fails the calling handler, so its task
     * stays pending and the backstop is attempted again on the next pass.
     *
     * @return the id of the scheduled task
     * @throws CleanupStoreException when the task could not be enqueued
     */
    public String schedule(CleanupKind kind, String prefix) {
        Instant deadline = clock.instant().plus(forceTimeout);
        try {
            String id = store.enqueueAt(deadline, kind, prefix, CleanupArgs.none());
            LOG.debug("scheduled {}({}) at {}", kind.wireName(), prefix, deadline);
            return id;
        } catch (RuntimeException e) {
            LOG.warn("couldn't schedule {} cleanup for {}: {}", kind.wireName(), prefix, e.getMessage());
            throw new CleanupStoreException("Failed to schedule " + kind.wireName() + " cleanup for " + prefix, e);
        }
    }

    private static Duration clamp(Duration timeout) {
        if (timeout.isNegative()) {
            return Duration.ZERO;
        }
        Duration max = Duration.ofMillis(FleetStateConfig.MAX_FORCE_TIMEOUT_MS);
        return timeout.compareTo(max) > 0 ? max : timeout;
    }
}

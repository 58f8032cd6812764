package io.fleetstate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fleetstate.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Tunables of the cleanup engine, read from {@code fleetstate-settings.json} under the
 * runtime root. Every field is optional; missing or out-of-range values fall back to the
 * defaults in {@link FleetStateConfig}.
 *
 * @param forceTimeoutMs     delay before a force backstop task becomes due, at most one day
 * @param voteRevokeAttempts attempts at clearing a controller machine's vote before giving up
 * @param drainBatchLimit    maximum due tasks handled per pass, 0 for no limit
 */
public record CleanupSettings(
        long forceTimeoutMs,
        int voteRevokeAttempts,
        int drainBatchLimit
) {
    public static CleanupSettings defaults() {
        return new CleanupSettings(
                FleetStateConfig.DEFAULT_FORCE_TIMEOUT_MS,
                FleetStateConfig.DEFAULT_VOTE_REVOKE_ATTEMPTS,
                FleetStateConfig.DEFAULT_DRAIN_BATCH_LIMIT
        );
    }

    public static CleanupSettings load(Path file) {
        CleanupSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load cleanup settings: " + file, e);
        }
    }

    static CleanupSettings fromFile(SettingsFile file, CleanupSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new CleanupSettings(
                clampForceTimeout(sanitizeLong(file.forceTimeoutMs(), defaults.forceTimeoutMs(), 0L)),
                sanitizeInt(file.voteRevokeAttempts(), defaults.voteRevokeAttempts(), 1),
                sanitizeInt(file.drainBatchLimit(), defaults.drainBatchLimit(), 0)
        );
    }

    public Duration forceTimeout() {
        return Duration.ofMillis(forceTimeoutMs);
    }

    public CleanupSettings withForceTimeout(Duration timeout) {
        long millis = timeout.compareTo(Duration.ofMillis(FleetStateConfig.MAX_FORCE_TIMEOUT_MS)) > 0
                ? FleetStateConfig.MAX_FORCE_TIMEOUT_MS
                : Math.max(0L, timeout.toMillis());
        return new CleanupSettings(millis, voteRevokeAttempts, drainBatchLimit);
    }

    private static long clampForceTimeout(long value) {
        return Math.min(value, FleetStateConfig.MAX_FORCE_TIMEOUT_MS);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long forceTimeoutMs,
            Integer voteRevokeAttempts,
            Integer drainBatchLimit
    ) {
    }
}

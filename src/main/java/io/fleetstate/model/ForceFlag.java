package io.fleetstate.model;

/**
 * Single optional {@code force} argument shared by several kinds. Absent means false.
 */
public record ForceFlag(boolean force, boolean legacy) {
    public static final int ARITY = 1;
    public static final ForceFlag LEGACY = new ForceFlag(false, true);

    public static ForceFlag of(boolean force) {
        return new ForceFlag(force, false);
    }

    public static ForceFlag decode(CleanupArgs args) {
        args.requireAtMost(ARITY);
        if (args.isEmpty()) {
            return LEGACY;
        }
        return new ForceFlag(args.bool(0, "force"), false);
    }

    public CleanupArgs toArgs() {
        return CleanupArgs.of(force);
    }
}

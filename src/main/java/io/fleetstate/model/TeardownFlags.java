package io.fleetstate.model;

/**
 * Arguments of the unit and model-storage teardown kinds: {@code [destroyStorage?, force?]}.
 *
 * @param legacy true when the task carried no arguments at all
 */
public record TeardownFlags(boolean destroyStorage, boolean force, boolean legacy) {
    public static final int ARITY = 2;

    /** Defaults for dying units and units of a dying application. */
    public static final TeardownFlags UNIT_LEGACY = new TeardownFlags(false, false, true);
    /** Defaults for storage of a dying model: storage used to be destroyed, not released. */
    public static final TeardownFlags MODEL_STORAGE_LEGACY = new TeardownFlags(true, false, true);

    public static TeardownFlags of(boolean destroyStorage, boolean force) {
        return new TeardownFlags(destroyStorage, force, false);
    }

    public static TeardownFlags decode(CleanupArgs args, TeardownFlags legacyDefaults) {
        args.requireAtMost(ARITY);
        if (args.isEmpty()) {
            return legacyDefaults;
        }
        boolean destroyStorage = args.bool(0, "destroyStorage");
        boolean force = args.size() >= 2 ? args.bool(1, "force") : legacyDefaults.force();
        return new TeardownFlags(destroyStorage, force, false);
    }

    public CleanupArgs toArgs() {
        return CleanupArgs.of(destroyStorage, force);
    }
}

package io.fleetstate.model;

import java.util.Optional;

/**
 * Closed set of cleanup task kinds. The wire name is what gets persisted, so it must never
 * change for an existing constant.
 */
public enum CleanupKind {
    RELATION_SETTINGS("settings", 0),
    UNITS_FOR_DYING_APPLICATION("units", TeardownFlags.ARITY),
    CHARM("charm", 0),
    DYING_UNIT("dyingUnit", TeardownFlags.ARITY),
    FORCE_DESTROYED_UNIT("forceDestroyUnit", 0),
    FORCE_REMOVE_UNIT("forceRemoveUnit", 0),
    REMOVED_UNIT("removedUnit", ForceFlag.ARITY),
    APPLICATIONS_FOR_DYING_MODEL("applications", 0),
    DYING_MACHINE("dyingMachine", ForceFlag.ARITY),
    FORCE_DESTROYED_MACHINE("machine", 0),
    ATTACHMENTS_FOR_DYING_STORAGE("storageAttachments", ForceFlag.ARITY),
    ATTACHMENTS_FOR_DYING_VOLUME("volumeAttachments", 0),
    ATTACHMENTS_FOR_DYING_FILESYSTEM("filesystemAttachments", 0),
    MODELS_FOR_DYING_CONTROLLER("models", DestroyModelParams.ARITY),
    MACHINES_FOR_DYING_MODEL("modelMachines", 0),
    DYING_UNIT_RESOURCES("dyingUnitResources", ForceFlag.ARITY),
    RESOURCE_BLOB("resourceBlob", 0),
    STORAGE_FOR_DYING_MODEL("modelStorage", TeardownFlags.ARITY);

    private final String wireName;
    private final int maxArgs;

    CleanupKind(String wireName, int maxArgs) {
        this.wireName = wireName;
        this.maxArgs = maxArgs;
    }

    public String wireName() {
        return wireName;
    }

    public int maxArgs() {
        return maxArgs;
    }

    public static Optional<CleanupKind> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (CleanupKind value : values()) {
            if (value.wireName.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Accepts either the wire name or the enum constant name, case-insensitively. Used by the CLI.
     */
    public static CleanupKind fromString(String raw) {
        if (raw != null) {
            for (CleanupKind value : values()) {
                if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown cleanup kind: " + raw);
    }
}

package io.fleetstate.state;

import java.util.Objects;

/**
 * Entity a volume or filesystem is attached to: a machine, or a unit on container models.
 */
public record HostTag(Kind kind, String id) {
    public enum Kind {
        MACHINE,
        UNIT
    }

    public HostTag {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("host id must not be blank");
        }
    }

    public static HostTag machine(String id) {
        return new HostTag(Kind.MACHINE, id);
    }

    public static HostTag unit(String name) {
        return new HostTag(Kind.UNIT, name);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + "-" + id;
    }
}

package io.fleetstate.state;

import java.util.Optional;

/**
 * @param backingVolumeId volume the filesystem lives on, or {@code null} when it has none
 */
public record Filesystem(String id, String backingVolumeId) {
    public Optional<String> backingVolume() {
        return Optional.ofNullable(backingVolumeId);
    }
}

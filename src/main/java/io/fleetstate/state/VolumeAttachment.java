package io.fleetstate.state;

public record VolumeAttachment(String volumeId, HostTag host) {
}

package io.fleetstate.state;

public record FilesystemAttachment(String filesystemId, HostTag host) {
}

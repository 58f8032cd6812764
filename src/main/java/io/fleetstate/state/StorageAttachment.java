package io.fleetstate.state;

public record StorageAttachment(String storageId, String unitName) {
}

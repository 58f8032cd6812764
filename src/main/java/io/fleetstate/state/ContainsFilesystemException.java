package io.fleetstate.state;

/**
 * A volume cannot be detached because it backs a filesystem; it goes away with that filesystem.
 */
public class ContainsFilesystemException extends StateException {
    public ContainsFilesystemException(String volumeId) {
        super("volume " + volumeId + " contains a filesystem");
    }
}

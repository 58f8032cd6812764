package io.fleetstate.state;

import io.fleetstate.model.Life;

import java.util.List;

public interface Unit {
    String name();

    Life life();

    List<Relation> relationsJoined();

    List<Relation> relationsInScope();

    List<String> subordinateNames();

    /**
     * Graceful destroy with the caller's storage and force choices.
     */
    void destroy(boolean destroyStorage, boolean force);

    /**
     * @return errors of individual operations that were skipped because of {@code force}
     */
    List<Exception> destroyWithForce(boolean force);

    /**
     * @throws HasSubordinatesException        when subordinates remain
     * @throws HasStorageAttachmentsException when storage is still attached
     */
    void ensureDead();

    /**
     * @return errors of individual operations that were skipped because of {@code force}
     */
    List<Exception> removeWithForce(boolean force);

    /**
     * Reloads the local snapshot.
     *
     * @throws NotFoundException when the unit has been removed meanwhile
     */
    void refresh();

    default HostTag hostTag() {
        return HostTag.unit(name());
    }
}

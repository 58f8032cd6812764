package io.fleetstate.state;

import io.fleetstate.model.Life;

import java.util.List;
import java.util.Optional;

public interface Machine {
    String id();

    Life life();

    boolean isManager();

    boolean hasVote();

    /**
     * Clears the controller vote if the stored document still has it.
     *
     * @return false when the document changed underneath and the update was not applied
     */
    boolean clearVote();

    void removeControllerMembership();

    /**
     * @return the host machine id when this machine is a container
     */
    Optional<String> parentId();

    boolean isManual();

    void destroy();

    void forceDestroy();

    List<String> containers();

    List<String> principals();

    void removeUpgradeSeriesLock();

    void refresh();

    void ensureDead();

    void remove();

    void removePorts();

    default HostTag hostTag() {
        return HostTag.machine(id());
    }
}

package io.fleetstate.cleanup;

import io.fleetstate.state.Machine;
import io.fleetstate.state.ModelState;
import io.fleetstate.state.NotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A machine and every container nested under it, collected breadth first into a flat list.
 * Walking the list backwards visits every container before the machine hosting it, without
 * recursion however deep the nesting goes.
 */
final class MachineTree {
    private final List<String> ids;

    private MachineTree(List<String> ids) {
        this.ids = ids;
    }

    static MachineTree collect(ModelState state, String rootId) {
        List<String> ids = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        ids.add(rootId);
        seen.add(rootId);
        for (int next = 0; next < ids.size(); next++) {
            List<String> containers;
            try {
                Machine machine = state.machine(ids.get(next));
                containers = machine.containers();
            } catch (NotFoundException e) {
                continue;
            }
            for (String containerId : containers) {
                if (seen.add(containerId)) {
                    ids.add(containerId);
                }
            }
        }
        return new MachineTree(ids);
    }

    String rootId() {
        return ids.get(0);
    }

    /** Every machine, hosts before the containers they host. */
    List<String> topDown() {
        return Collections.unmodifiableList(ids);
    }

    /** Containers only, each before the machine hosting it. */
    List<String> containersDeepestFirst() {
        List<String> out = new ArrayList<>(ids.subList(1, ids.size()));
        Collections.reverse(out);
        return out;
    }
}

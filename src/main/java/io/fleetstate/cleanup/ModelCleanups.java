package io.fleetstate.cleanup;

import io.fleetstate.model.DestroyModelParams;
import io.fleetstate.state.Application;
import io.fleetstate.state.Charm;
import io.fleetstate.state.CharmInUseException;
import io.fleetstate.state.CharmUrl;
import io.fleetstate.state.Model;
import io.fleetstate.state.ModelState;
import io.fleetstate.state.NotFoundException;
import io.fleetstate.state.RemoteApplication;
import io.fleetstate.state.StateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Model-wide cleanups plus the small document cleanups that hang off them.
 */
public final class ModelCleanups {
    private static final Logger LOG = LoggerFactory.getLogger(ModelCleanups.class);

    private final ModelState state;

    public ModelCleanups(ModelState state) {
        this.state = state;
    }

    public Diagnostics relationSettings(String prefix) {
        state.removeRelationSettings(prefix);
        return Diagnostics.none();
    }

    /**
     * Removes a charm nobody uses any more. Scheduled eagerly, so a charm still in use is not
     * an error: the cleanup simply has nothing to do yet.
     */
    public Diagnostics charm(String charmUrl) {
        CharmUrl url;
        try {
            url = CharmUrl.parse(charmUrl);
        } catch (IllegalArgumentException e) {
            throw new StateException("invalid charm URL " + charmUrl + ": " + e.getMessage(), e);
        }
        Charm charm;
        try {
            charm = state.charm(url);
        } catch (NotFoundException e) {
            return Diagnostics.none();
        } catch (StateException e) {
            throw new StateException("reading charm: " + e.getMessage(), e);
        }
        try {
            charm.destroy();
        } catch (CharmInUseException e) {
            LOG.debug("charm {} still in use", url);
            return Diagnostics.none();
        } catch (StateException e) {
            throw new StateException("destroying charm: " + e.getMessage(), e);
        }
        charm.remove();
        return Diagnostics.none();
    }

    /**
     * Destroys the alive remote applications of a dying model, then its alive applications
     * along with their offers.
     */
    public Diagnostics applicationsForDyingModel() {
        for (RemoteApplication remote : state.aliveRemoteApplications()) {
            remote.destroy();
        }
        for (Application application : state.aliveApplications()) {
            application.destroy(true);
        }
        return Diagnostics.none();
    }

    public Diagnostics modelsForDyingController(DestroyModelParams params) {
        for (String modelUuid : state.allModelUuids()) {
            Model model;
            try {
                model = state.model(modelUuid);
            } catch (NotFoundException e) {
                continue;
            }
            model.destroy(params);
        }
        return Diagnostics.none();
    }

    public Diagnostics resourceBlob(String storagePath) {
        // Placeholder resources have no blob.
        if (storagePath == null || storagePath.isEmpty()) {
            return Diagnostics.none();
        }
        try {
            state.removeResourceBlob(storagePath);
        } catch (NotFoundException e) {
            LOG.debug("resource blob {} already removed", storagePath);
        }
        return Diagnostics.none();
    }
}

package io.fleetstate.cleanup;

import io.fleetstate.model.ForceFlag;
import io.fleetstate.model.TeardownFlags;
import io.fleetstate.state.ContainsFilesystemException;
import io.fleetstate.state.Filesystem;
import io.fleetstate.state.FilesystemAttachment;
import io.fleetstate.state.HostTag;
import io.fleetstate.state.Machine;
import io.fleetstate.state.NotFoundException;
import io.fleetstate.state.StateException;
import io.fleetstate.state.StorageAttachment;
import io.fleetstate.state.StorageBackend;
import io.fleetstate.state.VolumeAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Storage teardown: attachment cleanups for dying storage, volumes and filesystems, and the
 * storage half of dying units and machines.
 */
public final class StorageCleanups {
    private static final Logger LOG = LoggerFactory.getLogger(StorageCleanups.class);

    private final StorageBackend storage;

    public StorageCleanups(StorageBackend storage) {
        this.storage = storage;
    }

    /**
     * Detaches every unit from a dying storage instance. Dying storage admits no new
     * attachments, so one enumeration sees all of them.
     */
    public Diagnostics attachmentsForDyingStorage(String storageId, ForceFlag flag) {
        Diagnostics diagnostics = new Diagnostics();
        StateException detachError = null;
        for (String unitName : storage.storageAttachmentUnits(storageId)) {
            try {
                storage.detachStorage(storageId, unitName, flag.force());
            } catch (NotFoundException e) {
                LOG.debug("storage {} already detached from {}", storageId, unitName);
            } catch (StateException e) {
                detachError = new StateException("destroying storage attachment: " + e.getMessage(), e);
                if (flag.force()) {
                    diagnostics.warn(LOG, "destroying storage attachment {} for {}: {}", storageId, unitName, e);
                } else {
                    LOG.warn("destroying storage attachment {} for {}: {}", storageId, unitName, e.getMessage());
                }
            }
        }
        if (!flag.force() && detachError != null) {
            throw detachError;
        }
        return diagnostics;
    }

    public Diagnostics attachmentsForDyingVolume(String volumeId) {
        for (HostTag host : storage.volumeAttachmentHosts(volumeId)) {
            try {
                storage.detachVolume(host, volumeId);
            } catch (NotFoundException e) {
                continue;
            } catch (StateException e) {
                throw new StateException("destroying volume attachment: " + e.getMessage(), e);
            }
            if (!storage.isDetachableVolume(volumeId) && !storage.isManualHost(host)) {
                // Nothing else will deprovision it: the volume goes with the host.
                try {
                    storage.removeVolumeAttachment(host, volumeId);
                } catch (NotFoundException e) {
                    LOG.debug("volume attachment {}:{} already removed", host, volumeId);
                }
            }
        }
        return Diagnostics.none();
    }

    public Diagnostics attachmentsForDyingFilesystem(String filesystemId) {
        for (HostTag host : storage.filesystemAttachmentHosts(filesystemId)) {
            try {
                storage.detachFilesystem(host, filesystemId);
            } catch (NotFoundException e) {
                continue;
            } catch (StateException e) {
                throw new StateException("destroying filesystem attachment: " + e.getMessage(), e);
            }
            if (!storage.isDetachableFilesystem(filesystemId) && !storage.isManualHost(host)) {
                try {
                    storage.removeFilesystemAttachment(host, filesystemId);
                } catch (NotFoundException e) {
                    LOG.debug("filesystem attachment {}:{} already removed", host, filesystemId);
                }
            }
        }
        return Diagnostics.none();
    }

    /**
     * Destroys or releases every storage instance of a dying model, attached or not.
     */
    public Diagnostics storageForDyingModel(TeardownFlags flags) {
        for (String storageId : storage.allStorageInstances()) {
            try {
                if (flags.destroyStorage()) {
                    storage.destroyStorageInstance(storageId, true, flags.force());
                } else {
                    storage.releaseStorageInstance(storageId, true, flags.force());
                }
            } catch (NotFoundException e) {
                LOG.debug("storage {} already gone", storageId);
            }
        }
        return Diagnostics.none();
    }

    public Diagnostics dyingUnitResources(String unitName, ForceFlag flag) {
        Diagnostics diagnostics = new Diagnostics();
        boolean force = flag.force();
        HostTag host = HostTag.unit(unitName);
        List<FilesystemAttachment> filesystemAttachments = List.of();
        try {
            filesystemAttachments = storage.filesystemAttachments(host);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "getting unit filesystem attachments: {}", e);
        }
        List<VolumeAttachment> volumeAttachments = List.of();
        try {
            volumeAttachments = storage.volumeAttachments(host);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "getting unit volume attachments: {}", e);
        }
        dyingEntityStorage(host, false, filesystemAttachments, volumeAttachments, force, diagnostics);
        return diagnostics;
    }

    void dyingMachineResources(Machine machine, boolean force, Diagnostics diagnostics) {
        HostTag host = machine.hostTag();
        List<FilesystemAttachment> filesystemAttachments = List.of();
        try {
            filesystemAttachments = storage.filesystemAttachments(host);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "getting machine filesystem attachments: {}", e);
        }
        List<VolumeAttachment> volumeAttachments = List.of();
        try {
            volumeAttachments = storage.volumeAttachments(host);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "getting machine volume attachments: {}", e);
        }
        boolean manual = false;
        try {
            manual = machine.isManual();
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "could not determine if machine {} is manual: {}", machine.id(), e);
        }
        dyingEntityStorage(host, manual, filesystemAttachments, volumeAttachments, force, diagnostics);
    }

    /**
     * Storage teardown shared by dying units and machines. Host-scoped filesystems are destroyed
     * first and every filesystem detached; on non-manual hosts the attachments and host
     * filesystems that nothing else will deprovision are removed right away. Volumes are
     * detached last, skipping those still backing a filesystem.
     */
    void dyingEntityStorage(
            HostTag host,
            boolean manual,
            List<FilesystemAttachment> filesystemAttachments,
            List<VolumeAttachment> volumeAttachments,
            boolean force,
            Diagnostics diagnostics
    ) {
        List<Filesystem> filesystems = List.of();
        try {
            filesystems = storage.hostFilesystems(host);
        } catch (NotFoundException e) {
            LOG.debug("no filesystems for {}", host);
        } catch (StateException e) {
            diagnostics.warn(LOG, "getting host filesystems for {}: {}", host, e);
        }
        for (Filesystem filesystem : filesystems) {
            try {
                storage.destroyFilesystem(filesystem.id());
            } catch (NotFoundException e) {
                LOG.debug("filesystem {} already gone", filesystem.id());
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not destroy filesystem {} for {}: {}", filesystem.id(), host, e);
            }
        }

        for (FilesystemAttachment attachment : filesystemAttachments) {
            String filesystemId = attachment.filesystemId();
            boolean detachable = false;
            try {
                detachable = storage.isDetachableFilesystem(filesystemId);
            } catch (NotFoundException e) {
                LOG.debug("filesystem {} already gone", filesystemId);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not determine if filesystem {} for {} is detachable: {}",
                        filesystemId, host, e);
            }
            if (detachable) {
                try {
                    storage.detachFilesystem(attachment.host(), filesystemId);
                } catch (NotFoundException e) {
                    LOG.debug("filesystem {} already detached from {}", filesystemId, attachment.host());
                } catch (StateException e) {
                    diagnostics.tolerate(force, e, LOG, "could not detach filesystem {} for {}: {}", filesystemId, host, e);
                }
            }
            if (!manual) {
                removeHostBoundAttachment(host, attachment, detachable, force, diagnostics);
            }
        }

        if (!manual) {
            for (Filesystem filesystem : filesystems) {
                try {
                    storage.removeFilesystem(filesystem.id());
                } catch (NotFoundException e) {
                    LOG.debug("filesystem {} already removed", filesystem.id());
                } catch (StateException e) {
                    diagnostics.tolerate(force, e, LOG, "could not remove filesystem {} for dying {}: {}",
                            filesystem.id(), host, e);
                }
            }
        }

        for (VolumeAttachment attachment : volumeAttachments) {
            String volumeId = attachment.volumeId();
            try {
                if (!storage.isDetachableVolume(volumeId)) {
                    // Removed along with the host.
                    continue;
                }
            } catch (NotFoundException e) {
                continue;
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not determine if volume {} for dying {} is detachable: {}",
                        volumeId, host, e);
            }
            try {
                storage.detachVolume(attachment.host(), volumeId);
            } catch (NotFoundException | ContainsFilesystemException e) {
                // A volume backing a filesystem is released once that filesystem is gone.
                LOG.debug("skipping volume {} on {}: {}", volumeId, host, e.getMessage());
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not detach volume {} for dying {}: {}", volumeId, host, e);
            }
        }
    }

    /**
     * Removes the attachment of a filesystem that is either bound to the host or lives on a
     * volume, since neither has a deprovisioning step left once the host goes.
     */
    private void removeHostBoundAttachment(
            HostTag host,
            FilesystemAttachment attachment,
            boolean detachable,
            boolean force,
            Diagnostics diagnostics
    ) {
        String filesystemId = attachment.filesystemId();
        boolean remove = !detachable;
        String backingVolume = null;
        if (detachable) {
            try {
                Filesystem filesystem = storage.filesystem(filesystemId);
                backingVolume = filesystem.backingVolumeId();
                remove = backingVolume != null;
            } catch (NotFoundException e) {
                LOG.debug("filesystem {} already gone", filesystemId);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not get filesystem {} for {}: {}", filesystemId, host, e);
            }
        }
        if (!remove) {
            return;
        }
        try {
            storage.removeFilesystemAttachment(attachment.host(), filesystemId);
        } catch (NotFoundException e) {
            LOG.debug("attachment of filesystem {} already removed", filesystemId);
        } catch (StateException e) {
            diagnostics.tolerate(force, e, LOG, "could not remove attachment for filesystem {} for {}: {}",
                    filesystemId, host, e);
        }
        if (backingVolume != null) {
            try {
                storage.removeVolumeAttachmentPlan(attachment.host(), backingVolume);
            } catch (NotFoundException e) {
                LOG.debug("attachment plan of volume {} already removed", backingVolume);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not remove attachment plan for volume {} for {}: {}",
                        backingVolume, host, e);
            }
            try {
                storage.setFilesystemDetached(filesystemId);
            } catch (NotFoundException e) {
                LOG.debug("filesystem {} already gone", filesystemId);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not update status while cleaning up storage for dying {}: {}",
                        host, e);
            }
        }
    }

    /**
     * Detaches each storage attachment of the unit, optionally removing the attachment record too.
     */
    void detachUnitStorage(String unitName, boolean remove, boolean force, Diagnostics diagnostics) {
        for (StorageAttachment attachment : storage.unitStorageAttachments(unitName)) {
            String storageId = attachment.storageId();
            try {
                storage.detachStorage(storageId, unitName, force);
            } catch (NotFoundException e) {
                continue;
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not detach storage {} for unit {}: {}", storageId, unitName, e);
            }
            if (!remove) {
                continue;
            }
            try {
                storage.removeStorageAttachment(storageId, unitName, force);
            } catch (NotFoundException e) {
                LOG.debug("storage attachment {} for {} already removed", storageId, unitName);
            } catch (StateException e) {
                diagnostics.tolerate(force, e, LOG, "could not remove storage attachment for storage {} for unit {}: {}",
                        storageId, unitName, e);
            }
        }
    }

    /**
     * Marks every storage instance attached to the unit dying.
     */
    void destroyUnitStorageInstances(String unitName, boolean force) {
        for (StorageAttachment attachment : storage.unitStorageAttachments(unitName)) {
            try {
                storage.destroyStorageInstance(attachment.storageId(), true, force);
            } catch (NotFoundException e) {
                LOG.debug("storage {} already gone", attachment.storageId());
            }
        }
    }

    void forceRemoveUnitStorageAttachments(String unitName, Diagnostics diagnostics) {
        try {
            storage.destroyUnitStorageAttachments(unitName);
        } catch (StateException e) {
            throw new StateException("destroying storage attachments for \"" + unitName + "\": " + e.getMessage(), e);
        }
        for (StorageAttachment attachment : storage.unitStorageAttachments(unitName)) {
            try {
                storage.removeStorageAttachment(attachment.storageId(), unitName, true);
            } catch (StateException e) {
                diagnostics.warn(LOG, "couldn't remove storage attachment {} for {}: {}", attachment.storageId(), unitName, e);
            }
        }
    }
}

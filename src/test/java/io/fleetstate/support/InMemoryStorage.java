package io.fleetstate.support;

import io.fleetstate.model.Life;
import io.fleetstate.state.ContainsFilesystemException;
import io.fleetstate.state.Filesystem;
import io.fleetstate.state.FilesystemAttachment;
import io.fleetstate.state.HostTag;
import io.fleetstate.state.NotFoundException;
import io.fleetstate.state.StorageAttachment;
import io.fleetstate.state.StorageBackend;
import io.fleetstate.state.VolumeAttachment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class InMemoryStorage implements StorageBackend {
    private final InMemoryModelState state;
    final Map<String, StorageInstanceRecord> storageInstances = new LinkedHashMap<>();
    final List<StorageAttachmentRecord> storageAttachments = new ArrayList<>();
    final Map<String, FilesystemRecord> filesystems = new LinkedHashMap<>();
    final Map<String, VolumeRecord> volumes = new LinkedHashMap<>();
    final List<FilesystemAttachmentRecord> filesystemAttachments = new ArrayList<>();
    final List<VolumeAttachmentRecord> volumeAttachments = new ArrayList<>();
    final Set<HostTag> manualHosts = new HashSet<>();

    InMemoryStorage(InMemoryModelState state) {
        this.state = state;
    }

    public StorageInstanceRecord addStorage(String storageId, String... attachedUnits) {
        StorageInstanceRecord record = new StorageInstanceRecord(storageId);
        storageInstances.put(storageId, record);
        for (String unit : attachedUnits) {
            storageAttachments.add(new StorageAttachmentRecord(storageId, unit));
        }
        return record;
    }

    public FilesystemRecord addFilesystem(String id, HostTag scopedTo, String backingVolumeId, boolean detachable) {
        FilesystemRecord record = new FilesystemRecord(id, scopedTo, backingVolumeId, detachable);
        filesystems.put(id, record);
        return record;
    }

    public VolumeRecord addVolume(String id, boolean detachable) {
        VolumeRecord record = new VolumeRecord(id, detachable);
        volumes.put(id, record);
        return record;
    }

    public FilesystemAttachmentRecord attachFilesystem(String filesystemId, HostTag host) {
        FilesystemAttachmentRecord record = new FilesystemAttachmentRecord(filesystemId, host);
        filesystemAttachments.add(record);
        return record;
    }

    public VolumeAttachmentRecord attachVolume(String volumeId, HostTag host) {
        VolumeAttachmentRecord record = new VolumeAttachmentRecord(volumeId, host);
        volumeAttachments.add(record);
        return record;
    }

    public void markManual(HostTag host) {
        manualHosts.add(host);
    }

    public Optional<StorageInstanceRecord> storageInstance(String id) {
        return Optional.ofNullable(storageInstances.get(id));
    }

    public Optional<StorageAttachmentRecord> storageAttachment(String storageId, String unitName) {
        return storageAttachments.stream()
                .filter(a -> a.storageId.equals(storageId) && a.unitName.equals(unitName))
                .findFirst();
    }

    public Optional<FilesystemRecord> filesystemRecord(String id) {
        return Optional.ofNullable(filesystems.get(id));
    }

    public Optional<FilesystemAttachmentRecord> filesystemAttachment(String filesystemId, HostTag host) {
        return filesystemAttachments.stream()
                .filter(a -> a.filesystemId.equals(filesystemId) && a.host.equals(host))
                .findFirst();
    }

    public Optional<VolumeAttachmentRecord> volumeAttachment(String volumeId, HostTag host) {
        return volumeAttachments.stream()
                .filter(a -> a.volumeId.equals(volumeId) && a.host.equals(host))
                .findFirst();
    }

    boolean hasAttachments(String unitName) {
        return storageAttachments.stream().anyMatch(a -> a.unitName.equals(unitName));
    }

    @Override
    public List<String> allStorageInstances() {
        state.maybeFail("allStorageInstances", "");
        return new ArrayList<>(storageInstances.keySet());
    }

    @Override
    public List<StorageAttachment> unitStorageAttachments(String unitName) {
        state.maybeFail("unitStorageAttachments", unitName);
        return storageAttachments.stream()
                .filter(a -> a.unitName.equals(unitName))
                .map(a -> new StorageAttachment(a.storageId, a.unitName))
                .toList();
    }

    @Override
    public List<String> storageAttachmentUnits(String storageId) {
        return storageAttachments.stream()
                .filter(a -> a.storageId.equals(storageId))
                .map(a -> a.unitName)
                .toList();
    }

    @Override
    public void detachStorage(String storageId, String unitName, boolean force) {
        state.maybeFail("detachStorage", storageId);
        StorageAttachmentRecord attachment = storageAttachment(storageId, unitName)
                .orElseThrow(() -> NotFoundException.of("storage attachment", storageId + ":" + unitName));
        attachment.life = Life.DYING;
        state.event("detachStorage " + storageId + " " + unitName);
    }

    @Override
    public void removeStorageAttachment(String storageId, String unitName, boolean force) {
        state.maybeFail("removeStorageAttachment", storageId);
        StorageAttachmentRecord attachment = storageAttachment(storageId, unitName)
                .orElseThrow(() -> NotFoundException.of("storage attachment", storageId + ":" + unitName));
        storageAttachments.remove(attachment);
        state.event("removeStorageAttachment " + storageId + " " + unitName);
    }

    @Override
    public void destroyStorageInstance(String storageId, boolean destroyAttached, boolean force) {
        state.maybeFail("destroyStorageInstance", storageId);
        StorageInstanceRecord record = requireStorage(storageId);
        record.life = Life.DYING;
        markAttachmentsDying(storageId);
        state.event("destroyStorageInstance " + storageId);
    }

    @Override
    public void releaseStorageInstance(String storageId, boolean destroyAttached, boolean force) {
        state.maybeFail("releaseStorageInstance", storageId);
        StorageInstanceRecord record = requireStorage(storageId);
        record.life = Life.DYING;
        record.released = true;
        markAttachmentsDying(storageId);
        state.event("releaseStorageInstance " + storageId);
    }

    @Override
    public void destroyUnitStorageAttachments(String unitName) {
        state.maybeFail("destroyUnitStorageAttachments", unitName);
        for (StorageAttachmentRecord attachment : storageAttachments) {
            if (attachment.unitName.equals(unitName)) {
                attachment.life = Life.DYING;
            }
        }
    }

    @Override
    public List<FilesystemAttachment> filesystemAttachments(HostTag host) {
        state.maybeFail("filesystemAttachments", host.id());
        return filesystemAttachments.stream()
                .filter(a -> a.host.equals(host))
                .map(a -> new FilesystemAttachment(a.filesystemId, a.host))
                .toList();
    }

    @Override
    public List<VolumeAttachment> volumeAttachments(HostTag host) {
        state.maybeFail("volumeAttachments", host.id());
        return volumeAttachments.stream()
                .filter(a -> a.host.equals(host))
                .map(a -> new VolumeAttachment(a.volumeId, a.host))
                .toList();
    }

    @Override
    public List<HostTag> filesystemAttachmentHosts(String filesystemId) {
        return filesystemAttachments.stream()
                .filter(a -> a.filesystemId.equals(filesystemId))
                .map(a -> a.host)
                .toList();
    }

    @Override
    public List<HostTag> volumeAttachmentHosts(String volumeId) {
        return volumeAttachments.stream()
                .filter(a -> a.volumeId.equals(volumeId))
                .map(a -> a.host)
                .toList();
    }

    @Override
    public List<Filesystem> hostFilesystems(HostTag host) {
        return filesystems.values().stream()
                .filter(f -> host.equals(f.scopedTo))
                .map(FilesystemRecord::view)
                .toList();
    }

    @Override
    public Filesystem filesystem(String filesystemId) {
        return requireFilesystem(filesystemId).view();
    }

    @Override
    public boolean isDetachableFilesystem(String filesystemId) {
        return requireFilesystem(filesystemId).detachable;
    }

    @Override
    public boolean isDetachableVolume(String volumeId) {
        VolumeRecord volume = volumes.get(volumeId);
        if (volume == null) {
            throw NotFoundException.of("volume", volumeId);
        }
        return volume.detachable;
    }

    @Override
    public boolean isManualHost(HostTag host) {
        return manualHosts.contains(host);
    }

    @Override
    public void destroyFilesystem(String filesystemId) {
        state.maybeFail("destroyFilesystem", filesystemId);
        requireFilesystem(filesystemId).life = Life.DYING;
        state.event("destroyFilesystem " + filesystemId);
    }

    @Override
    public void removeFilesystem(String filesystemId) {
        state.maybeFail("removeFilesystem", filesystemId);
        requireFilesystem(filesystemId);
        filesystems.remove(filesystemId);
        state.event("removeFilesystem " + filesystemId);
    }

    @Override
    public void detachFilesystem(HostTag host, String filesystemId) {
        state.maybeFail("detachFilesystem", filesystemId);
        FilesystemAttachmentRecord attachment = filesystemAttachment(filesystemId, host)
                .orElseThrow(() -> NotFoundException.of("filesystem attachment", filesystemId + ":" + host));
        attachment.life = Life.DYING;
        state.event("detachFilesystem " + filesystemId + " " + host);
    }

    @Override
    public void removeFilesystemAttachment(HostTag host, String filesystemId) {
        state.maybeFail("removeFilesystemAttachment", filesystemId);
        FilesystemAttachmentRecord attachment = filesystemAttachment(filesystemId, host)
                .orElseThrow(() -> NotFoundException.of("filesystem attachment", filesystemId + ":" + host));
        filesystemAttachments.remove(attachment);
        state.event("removeFilesystemAttachment " + filesystemId + " " + host);
    }

    @Override
    public void setFilesystemDetached(String filesystemId) {
        requireFilesystem(filesystemId).detachedStatus = true;
    }

    @Override
    public void detachVolume(HostTag host, String volumeId) {
        state.maybeFail("detachVolume", volumeId);
        boolean backsFilesystem = filesystems.values().stream()
                .anyMatch(f -> volumeId.equals(f.backingVolumeId));
        if (backsFilesystem) {
            throw new ContainsFilesystemException(volumeId);
        }
        VolumeAttachmentRecord attachment = volumeAttachment(volumeId, host)
                .orElseThrow(() -> NotFoundException.of("volume attachment", volumeId + ":" + host));
        attachment.life = Life.DYING;
        state.event("detachVolume " + volumeId + " " + host);
    }

    @Override
    public void removeVolumeAttachment(HostTag host, String volumeId) {
        VolumeAttachmentRecord attachment = volumeAttachment(volumeId, host)
                .orElseThrow(() -> NotFoundException.of("volume attachment", volumeId + ":" + host));
        volumeAttachments.remove(attachment);
        state.event("removeVolumeAttachment " + volumeId + " " + host);
    }

    @Override
    public void removeVolumeAttachmentPlan(HostTag host, String volumeId) {
        VolumeAttachmentRecord attachment = volumeAttachment(volumeId, host)
                .orElseThrow(() -> NotFoundException.of("volume attachment plan", volumeId + ":" + host));
        attachment.planned = false;
        state.event("removeVolumeAttachmentPlan " + volumeId + " " + host);
    }

    private void markAttachmentsDying(String storageId) {
        for (StorageAttachmentRecord attachment : storageAttachments) {
            if (attachment.storageId.equals(storageId)) {
                attachment.life = Life.DYING;
            }
        }
    }

    private StorageInstanceRecord requireStorage(String storageId) {
        StorageInstanceRecord record = storageInstances.get(storageId);
        if (record == null) {
            throw NotFoundException.of("storage", storageId);
        }
        return record;
    }

    private FilesystemRecord requireFilesystem(String filesystemId) {
        FilesystemRecord record = filesystems.get(filesystemId);
        if (record == null) {
            throw NotFoundException.of("filesystem", filesystemId);
        }
        return record;
    }

    public static final class StorageInstanceRecord {
        public final String id;
        public Life life = Life.ALIVE;
        public boolean released;

        StorageInstanceRecord(String id) {
            this.id = id;
        }
    }

    public static final class StorageAttachmentRecord {
        public final String storageId;
        public final String unitName;
        public Life life = Life.ALIVE;

        StorageAttachmentRecord(String storageId, String unitName) {
            this.storageId = storageId;
            this.unitName = unitName;
        }
    }

    public static final class FilesystemRecord {
        public final String id;
        public final HostTag scopedTo;
        public final String backingVolumeId;
        public final boolean detachable;
        public Life life = Life.ALIVE;
        public boolean detachedStatus;

        FilesystemRecord(String id, HostTag scopedTo, String backingVolumeId, boolean detachable) {
            this.id = id;
            this.scopedTo = scopedTo;
            this.backingVolumeId = backingVolumeId;
            this.detachable = detachable;
        }

        Filesystem view() {
            return new Filesystem(id, backingVolumeId);
        }
    }

    public static final class VolumeRecord {
        public final String id;
        public final boolean detachable;

        VolumeRecord(String id, boolean detachable) {
            this.id = id;
            this.detachable = detachable;
        }
    }

    public static final class FilesystemAttachmentRecord {
        public final String filesystemId;
        public final HostTag host;
        public Life life = Life.ALIVE;

        FilesystemAttachmentRecord(String filesystemId, HostTag host) {
            this.filesystemId = filesystemId;
            this.host = Objects.requireNonNull(host);
        }
    }

    public static final class VolumeAttachmentRecord {
        public final String volumeId;
        public final HostTag host;
        public Life life = Life.ALIVE;
        public boolean planned = true;

        VolumeAttachmentRecord(String volumeId, HostTag host) {
            this.volumeId = volumeId;
            this.host = Objects.requireNonNull(host);
        }
    }
}

package io.fleetstate.state;

import java.util.List;

/**
 * Storage side of the entity-lifecycle layer. Every mutation commits on its own and throws
 * {@link NotFoundException} when its target no longer exists.
 */
public interface StorageBackend {
    List<String> allStorageInstances();

    List<StorageAttachment> unitStorageAttachments(String unitName);

    /** Units attached to the storage instance. */
    List<String> storageAttachmentUnits(String storageId);

    void detachStorage(String storageId, String unitName, boolean force);

    void removeStorageAttachment(String storageId, String unitName, boolean force);

    void destroyStorageInstance(String storageId, boolean destroyAttached, boolean force);

    void releaseStorageInstance(String storageId, boolean destroyAttached, boolean force);

    void destroyUnitStorageAttachments(String unitName);

    List<FilesystemAttachment> filesystemAttachments(HostTag host);

    List<VolumeAttachment> volumeAttachments(HostTag host);

    List<HostTag> filesystemAttachmentHosts(String filesystemId);

    List<HostTag> volumeAttachmentHosts(String volumeId);

    /** Filesystems scoped to the host itself; these cannot outlive it. */
    List<Filesystem> hostFilesystems(HostTag host);

    Filesystem filesystem(String filesystemId);

    boolean isDetachableFilesystem(String filesystemId);

    boolean isDetachableVolume(String volumeId);

    /** True for hosts whose storage must be dealt with by an operator. */
    boolean isManualHost(HostTag host);

    void destroyFilesystem(String filesystemId);

    void removeFilesystem(String filesystemId);

    void detachFilesystem(HostTag host, String filesystemId);

    void removeFilesystemAttachment(HostTag host, String filesystemId);

    void setFilesystemDetached(String filesystemId);

    /**
     * @throws ContainsFilesystemException when the volume backs a filesystem
     */
    void detachVolume(HostTag host, String volumeId);

    void removeVolumeAttachment(HostTag host, String volumeId);

    void removeVolumeAttachmentPlan(HostTag host, String volumeId);
}

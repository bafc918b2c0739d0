package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.VolumeSnapshot;

import java.util.List;

public enum VolumeSnapshotProperties implements ResourceProperty<VolumeSnapshot> {
    SNAPSHOT_ID("id", PropertyKind.STRING, PropertyExtractor.direct(VolumeSnapshot::getId), "snapshot_id"),
    SNAPSHOT_NAME("name", PropertyKind.STRING, PropertyExtractor.direct(VolumeSnapshot::getName), "snapshot_name"),
    SNAPSHOT_DESCRIPTION("description", PropertyKind.STRING,
            PropertyExtractor.direct(VolumeSnapshot::getDescription)),
    SNAPSHOT_STATUS("status", PropertyKind.STRING, PropertyExtractor.direct(VolumeSnapshot::getStatus),
            "snapshot_status"),
    SNAPSHOT_SIZE("size", PropertyKind.INTEGER, PropertyExtractor.direct(VolumeSnapshot::getSize),
            "snapshot_size", "size_gb"),
    VOLUME_ID("volume_id", PropertyKind.STRING, PropertyExtractor.direct(VolumeSnapshot::getVolumeId)),
    PROJECT_ID("project_id", PropertyKind.STRING, PropertyExtractor.direct(VolumeSnapshot::getProjectId)),
    SNAPSHOT_CREATION_DATE("created_at", PropertyKind.DATETIME,
            PropertyExtractor.direct(VolumeSnapshot::getCreatedAt), "snapshot_creation_date"),
    SNAPSHOT_LAST_UPDATED_DATE("updated_at", PropertyKind.DATETIME,
            PropertyExtractor.direct(VolumeSnapshot::getUpdatedAt), "snapshot_last_updated_date"),
    PROJECT_NAME("project_name", PropertyKind.STRING,
            (snapshot, aux) -> aux.projectField(snapshot.getProjectId(), Project::getName)),
    PROJECT_EMAIL("project_email", PropertyKind.STRING,
            (snapshot, aux) -> aux.projectField(snapshot.getProjectId(), Project::getEmail));

    private final String propertyName;
    private final PropertyKind kind;
    private final PropertyExtractor<VolumeSnapshot> extractor;
    private final List<String> aliases;

    VolumeSnapshotProperties(String propertyName, PropertyKind kind, PropertyExtractor<VolumeSnapshot> extractor,
                             String... aliases) {
        this.propertyName = propertyName;
        this.kind = kind;
        this.extractor = extractor;
        this.aliases = List.of(aliases);
    }

    @Override
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public PropertyKind getKind() {
        return kind;
    }

    @Override
    public List<String> getAliases() {
        return aliases;
    }

    @Override
    public boolean isDerived() {
        return this == PROJECT_NAME || this == PROJECT_EMAIL;
    }

    @Override
    public Object extract(VolumeSnapshot resource, AuxiliaryData auxiliaryData) {
        return extractor.extract(resource, auxiliaryData);
    }

    public static VolumeSnapshotProperties fromString(String name) {
        return Properties.fromString(VolumeSnapshotProperties.class, name, "volume_snapshot");
    }
}

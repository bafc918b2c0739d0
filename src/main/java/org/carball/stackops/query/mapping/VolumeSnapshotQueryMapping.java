package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.property.VolumeSnapshotProperties;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.model.resource.VolumeSnapshot;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.carball.stackops.query.handler.ServerSideFilters.equalTo;

public class VolumeSnapshotQueryMapping extends QueryMapping<VolumeSnapshot> {

    public VolumeSnapshotQueryMapping(Clock clock) {
        super(clock);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.VOLUME_SNAPSHOT;
    }

    @Override
    public List<ResourceProperty<VolumeSnapshot>> getProperties() {
        return Arrays.<ResourceProperty<VolumeSnapshot>>asList(VolumeSnapshotProperties.values());
    }

    @Override
    public ResourceProperty<VolumeSnapshot> resolveProperty(String name) {
        return VolumeSnapshotProperties.fromString(name);
    }

    @Override
    public List<ResourceProperty<VolumeSnapshot>> getDefaultOutputProperties() {
        return List.of(VolumeSnapshotProperties.SNAPSHOT_ID, VolumeSnapshotProperties.SNAPSHOT_NAME);
    }

    @Override
    public ResourceLister<VolumeSnapshot> selectLister(CloudClient client) {
        return client.volumeSnapshots();
    }

    @Override
    protected PresetPropertyMappings genericMappings() {
        return allGenericPresetsOn(getProperties());
    }

    @Override
    protected PresetPropertyMappings integerMappings() {
        return allIntegerPresetsOn(propertiesOfKind(PropertyKind.INTEGER));
    }

    @Override
    protected PresetPropertyMappings stringMappings() {
        return allStringPresetsOn(propertiesOfKind(PropertyKind.STRING));
    }

    @Override
    protected PresetPropertyMappings dateTimeMappings() {
        return allDateTimePresetsOn(propertiesOfKind(PropertyKind.DATETIME));
    }

    @Override
    protected ServerSideHandler buildServerSideHandler(Clock clock) {
        // Cinder only filters snapshots on exact values, one value per key
        return ServerSideHandler.builder()
                .map(QueryPresetsGeneric.EQUAL_TO, VolumeSnapshotProperties.SNAPSHOT_STATUS, equalTo("status"))
                .map(QueryPresetsGeneric.EQUAL_TO, VolumeSnapshotProperties.SNAPSHOT_NAME, equalTo("name"))
                .map(QueryPresetsGeneric.EQUAL_TO, VolumeSnapshotProperties.VOLUME_ID, equalTo("volume_id"))
                .map(QueryPresetsGeneric.EQUAL_TO, VolumeSnapshotProperties.PROJECT_ID, equalTo("project_id"))
                .build();
    }
}

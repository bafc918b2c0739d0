package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.property.FloatingIpProperties;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.carball.stackops.query.handler.ServerSideFilters.anyIn;
import static org.carball.stackops.query.handler.ServerSideFilters.equalTo;

public class FloatingIpQueryMapping extends QueryMapping<FloatingIp> {

    public FloatingIpQueryMapping(Clock clock) {
        super(clock);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.FLOATING_IP;
    }

    @Override
    public List<ResourceProperty<FloatingIp>> getProperties() {
        return Arrays.<ResourceProperty<FloatingIp>>asList(FloatingIpProperties.values());
    }

    @Override
    public ResourceProperty<FloatingIp> resolveProperty(String name) {
        return FloatingIpProperties.fromString(name);
    }

    @Override
    public List<ResourceProperty<FloatingIp>> getDefaultOutputProperties() {
        return List.of(FloatingIpProperties.FIP_ID, FloatingIpProperties.FLOATING_IP_ADDRESS);
    }

    @Override
    public ResourceLister<FloatingIp> selectLister(CloudClient client) {
        return client.floatingIps();
    }

    @Override
    protected PresetPropertyMappings genericMappings() {
        return allGenericPresetsOn(getProperties());
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
        ServerSideHandler.Builder builder = ServerSideHandler.builder();
        for (FloatingIpProperties property : List.of(FloatingIpProperties.FIP_ID, FloatingIpProperties.FIP_STATUS,
                FloatingIpProperties.PROJECT_ID, FloatingIpProperties.PORT_ID, FloatingIpProperties.ROUTER_ID,
                FloatingIpProperties.FLOATING_IP_ADDRESS)) {
            builder.map(QueryPresetsGeneric.EQUAL_TO, property, equalTo(property.getPropertyName()))
                    .map(QueryPresetsGeneric.ANY_IN, property, anyIn(property.getPropertyName()));
        }
        return builder.build();
    }
}

package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.property.LoadBalancerProperties;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.carball.stackops.query.handler.ServerSideFilters.anyIn;
import static org.carball.stackops.query.handler.ServerSideFilters.equalTo;

public class LoadBalancerQueryMapping extends QueryMapping<LoadBalancer> {

    public LoadBalancerQueryMapping(Clock clock) {
        super(clock);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.LOAD_BALANCER;
    }

    @Override
    public List<ResourceProperty<LoadBalancer>> getProperties() {
        return Arrays.<ResourceProperty<LoadBalancer>>asList(LoadBalancerProperties.values());
    }

    @Override
    public ResourceProperty<LoadBalancer> resolveProperty(String name) {
        return LoadBalancerProperties.fromString(name);
    }

    @Override
    public List<ResourceProperty<LoadBalancer>> getDefaultOutputProperties() {
        return List.of(LoadBalancerProperties.LB_ID, LoadBalancerProperties.LB_NAME);
    }

    @Override
    public ResourceLister<LoadBalancer> selectLister(CloudClient client) {
        return client.loadBalancers();
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
        for (LoadBalancerProperties property : List.of(LoadBalancerProperties.LB_ID, LoadBalancerProperties.LB_NAME,
                LoadBalancerProperties.PROVISIONING_STATUS, LoadBalancerProperties.OPERATING_STATUS,
                LoadBalancerProperties.VIP_ADDRESS, LoadBalancerProperties.PROJECT_ID)) {
            builder.map(QueryPresetsGeneric.EQUAL_TO, property, equalTo(property.getPropertyName()))
                    .map(QueryPresetsGeneric.ANY_IN, property, anyIn(property.getPropertyName()));
        }
        return builder.build();
    }
}

package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.property.UserProperties;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.model.resource.User;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.carball.stackops.query.handler.ServerSideFilters.equalTo;

public class UserQueryMapping extends QueryMapping<User> {

    public UserQueryMapping(Clock clock) {
        super(clock);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.USER;
    }

    @Override
    public List<ResourceProperty<User>> getProperties() {
        return Arrays.<ResourceProperty<User>>asList(UserProperties.values());
    }

    @Override
    public ResourceProperty<User> resolveProperty(String name) {
        return UserProperties.fromString(name);
    }

    @Override
    public List<ResourceProperty<User>> getDefaultOutputProperties() {
        return List.of(UserProperties.USER_ID, UserProperties.USER_NAME);
    }

    @Override
    public ResourceLister<User> selectLister(CloudClient client) {
        return client.users();
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
        return PresetPropertyMappings.empty();
    }

    @Override
    protected ServerSideHandler buildServerSideHandler(Clock clock) {
        return ServerSideHandler.builder()
                .map(QueryPresetsGeneric.EQUAL_TO, UserProperties.USER_NAME, equalTo("name"))
                .map(QueryPresetsGeneric.EQUAL_TO, UserProperties.USER_DOMAIN_ID, equalTo("domain_id"))
                .map(QueryPresetsGeneric.EQUAL_TO, UserProperties.USER_IS_ENABLED, equalTo("enabled"))
                .build();
    }
}

package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsDateTime;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.property.ServerProperties;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.carball.stackops.query.handler.ServerSideFilters.allTenants;
import static org.carball.stackops.query.handler.ServerSideFilters.anyIn;
import static org.carball.stackops.query.handler.ServerSideFilters.equalTo;
import static org.carball.stackops.query.handler.ServerSideFilters.lowerTimestampBound;
import static org.carball.stackops.query.handler.ServerSideFilters.upperTimestampBound;

public class ServerQueryMapping extends QueryMapping<Server> {

    public ServerQueryMapping(Clock clock) {
        super(clock);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.SERVER;
    }

    @Override
    public List<ResourceProperty<Server>> getProperties() {
        return Arrays.<ResourceProperty<Server>>asList(ServerProperties.values());
    }

    @Override
    public ResourceProperty<Server> resolveProperty(String name) {
        return ServerProperties.fromString(name);
    }

    @Override
    public List<ResourceProperty<Server>> getDefaultOutputProperties() {
        return List.of(ServerProperties.SERVER_ID, ServerProperties.SERVER_NAME);
    }

    @Override
    public ResourceLister<Server> selectLister(CloudClient client) {
        return client.servers();
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
        return ServerSideHandler.builder()
                .map(QueryPresetsGeneric.EQUAL_TO, ServerProperties.SERVER_ID, equalTo("uuid"))
                .map(QueryPresetsGeneric.ANY_IN, ServerProperties.SERVER_ID, anyIn("uuid"))
                .map(QueryPresetsGeneric.EQUAL_TO, ServerProperties.SERVER_STATUS, equalTo("status"))
                .map(QueryPresetsGeneric.ANY_IN, ServerProperties.SERVER_STATUS, anyIn("status"))
                .map(QueryPresetsGeneric.EQUAL_TO, ServerProperties.FLAVOR_ID, equalTo("flavor"))
                .map(QueryPresetsGeneric.ANY_IN, ServerProperties.FLAVOR_ID, anyIn("flavor"))
                .map(QueryPresetsGeneric.EQUAL_TO, ServerProperties.IMAGE_ID, equalTo("image"))
                .map(QueryPresetsGeneric.ANY_IN, ServerProperties.IMAGE_ID, anyIn("image"))
                .map(QueryPresetsGeneric.EQUAL_TO, ServerProperties.PROJECT_ID, allTenants(equalTo("project_id")))
                .map(QueryPresetsGeneric.ANY_IN, ServerProperties.PROJECT_ID, allTenants(anyIn("project_id")))
                .map(QueryPresetsGeneric.EQUAL_TO, ServerProperties.USER_ID, allTenants(equalTo("user_id")))
                .map(QueryPresetsGeneric.ANY_IN, ServerProperties.USER_ID, allTenants(anyIn("user_id")))
                .map(QueryPresetsDateTime.YOUNGER_THAN_OR_EQUAL, ServerProperties.SERVER_LAST_UPDATED_DATE,
                        lowerTimestampBound("changes-since", clock))
                .map(QueryPresetsDateTime.OLDER_THAN_OR_EQUAL, ServerProperties.SERVER_LAST_UPDATED_DATE,
                        upperTimestampBound("changes-before", clock))
                .map(QueryPresetsDateTime.OLDER_THAN, ServerProperties.SERVER_LAST_UPDATED_DATE,
                        upperTimestampBound("changes-before", clock))
                .build();
    }
}

package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.property.ProjectProperties;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

import static org.carball.stackops.query.handler.ServerSideFilters.anyIn;
import static org.carball.stackops.query.handler.ServerSideFilters.equalTo;

public class ProjectQueryMapping extends QueryMapping<Project> {

    public ProjectQueryMapping(Clock clock) {
        super(clock);
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.PROJECT;
    }

    @Override
    public List<ResourceProperty<Project>> getProperties() {
        return Arrays.<ResourceProperty<Project>>asList(ProjectProperties.values());
    }

    @Override
    public ResourceProperty<Project> resolveProperty(String name) {
        return ProjectProperties.fromString(name);
    }

    @Override
    public List<ResourceProperty<Project>> getDefaultOutputProperties() {
        return List.of(ProjectProperties.PROJECT_ID, ProjectProperties.PROJECT_NAME);
    }

    @Override
    public ResourceLister<Project> selectLister(CloudClient client) {
        return client.projects();
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
        ServerSideHandler.Builder builder = ServerSideHandler.builder();
        for (ProjectProperties property : List.of(ProjectProperties.PROJECT_ID, ProjectProperties.PROJECT_NAME,
                ProjectProperties.PROJECT_DOMAIN_ID, ProjectProperties.PROJECT_PARENT_ID)) {
            builder.map(QueryPresetsGeneric.EQUAL_TO, property, equalTo(property.getPropertyName()))
                    .map(QueryPresetsGeneric.ANY_IN, property, anyIn(property.getPropertyName()));
        }
        return builder
                .map(QueryPresetsGeneric.EQUAL_TO, ProjectProperties.PROJECT_IS_ENABLED, equalTo("enabled"))
                .build();
    }
}

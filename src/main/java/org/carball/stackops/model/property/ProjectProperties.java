package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.Project;

import java.util.List;

public enum ProjectProperties implements ResourceProperty<Project> {
    PROJECT_ID("id", PropertyKind.STRING, PropertyExtractor.direct(Project::getId), "project_id"),
    PROJECT_NAME("name", PropertyKind.STRING, PropertyExtractor.direct(Project::getName), "project_name"),
    PROJECT_DESCRIPTION("description", PropertyKind.STRING, PropertyExtractor.direct(Project::getDescription),
            "project_description"),
    PROJECT_EMAIL("email", PropertyKind.STRING, PropertyExtractor.direct(Project::getEmail), "project_email"),
    PROJECT_DOMAIN_ID("domain_id", PropertyKind.STRING, PropertyExtractor.direct(Project::getDomainId)),
    PROJECT_PARENT_ID("parent_id", PropertyKind.STRING, PropertyExtractor.direct(Project::getParentId)),
    PROJECT_IS_ENABLED("enabled", PropertyKind.BOOLEAN, PropertyExtractor.direct(Project::getEnabled),
            "is_enabled");

    private final String propertyName;
    private final PropertyKind kind;
    private final PropertyExtractor<Project> extractor;
    private final List<String> aliases;

    ProjectProperties(String propertyName, PropertyKind kind, PropertyExtractor<Project> extractor,
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
        return false;
    }

    @Override
    public Object extract(Project resource, AuxiliaryData auxiliaryData) {
        return extractor.extract(resource, auxiliaryData);
    }

    public static ProjectProperties fromString(String name) {
        return Properties.fromString(ProjectProperties.class, name, "project");
    }
}

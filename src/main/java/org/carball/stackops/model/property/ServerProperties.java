package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.model.resource.User;

import java.util.List;

public enum ServerProperties implements ResourceProperty<Server> {
    SERVER_ID("id", PropertyKind.STRING, PropertyExtractor.direct(Server::getId), "server_id", "uuid"),
    SERVER_NAME("name", PropertyKind.STRING, PropertyExtractor.direct(Server::getName), "server_name"),
    SERVER_DESCRIPTION("description", PropertyKind.STRING, PropertyExtractor.direct(Server::getDescription),
            "server_description"),
    SERVER_STATUS("status", PropertyKind.STRING, PropertyExtractor.direct(Server::getStatus), "server_status"),
    SERVER_CREATION_DATE("created_at", PropertyKind.DATETIME, PropertyExtractor.direct(Server::getCreatedAt),
            "server_creation_date", "created"),
    SERVER_LAST_UPDATED_DATE("updated_at", PropertyKind.DATETIME, PropertyExtractor.direct(Server::getUpdatedAt),
            "server_last_updated_date", "updated"),
    FLAVOR_ID("flavor_id", PropertyKind.STRING, PropertyExtractor.direct(Server::getFlavorId)),
    IMAGE_ID("image_id", PropertyKind.STRING, PropertyExtractor.direct(Server::getImageId)),
    HYPERVISOR_NAME("hypervisor_name", PropertyKind.STRING, PropertyExtractor.direct(Server::getHypervisorHostname),
            "hypervisor_hostname", "host"),
    PROJECT_ID("project_id", PropertyKind.STRING, PropertyExtractor.direct(Server::getProjectId)),
    USER_ID("user_id", PropertyKind.STRING, PropertyExtractor.direct(Server::getUserId)),
    PROJECT_NAME("project_name", PropertyKind.STRING,
            (server, aux) -> aux.projectField(server.getProjectId(), Project::getName)),
    PROJECT_EMAIL("project_email", PropertyKind.STRING,
            (server, aux) -> aux.projectField(server.getProjectId(), Project::getEmail)),
    USER_NAME("user_name", PropertyKind.STRING,
            (server, aux) -> aux.userField(server.getUserId(), User::getName)),
    USER_EMAIL("user_email", PropertyKind.STRING,
            (server, aux) -> aux.userField(server.getUserId(), User::getEmail), "email");

    private final String propertyName;
    private final PropertyKind kind;
    private final PropertyExtractor<Server> extractor;
    private final List<String> aliases;

    ServerProperties(String propertyName, PropertyKind kind, PropertyExtractor<Server> extractor, String... aliases) {
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
        return this == PROJECT_NAME || this == PROJECT_EMAIL || this == USER_NAME || this == USER_EMAIL;
    }

    @Override
    public Object extract(Server resource, AuxiliaryData auxiliaryData) {
        return extractor.extract(resource, auxiliaryData);
    }

    public static ServerProperties fromString(String name) {
        return Properties.fromString(ServerProperties.class, name, "server");
    }
}

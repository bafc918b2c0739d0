package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.Project;

import java.util.List;

public enum FloatingIpProperties implements ResourceProperty<FloatingIp> {
    FIP_ID("id", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getId), "fip_id", "floating_ip_id"),
    FIP_NAME("name", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getName), "fip_name"),
    FIP_DESCRIPTION("description", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getDescription)),
    FIP_STATUS("status", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getStatus), "fip_status"),
    FLOATING_IP_ADDRESS("floating_ip_address", PropertyKind.STRING,
            PropertyExtractor.direct(FloatingIp::getFloatingIpAddress), "ip_address", "address"),
    FIXED_IP_ADDRESS("fixed_ip_address", PropertyKind.STRING,
            PropertyExtractor.direct(FloatingIp::getFixedIpAddress)),
    PORT_ID("port_id", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getPortId)),
    ROUTER_ID("router_id", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getRouterId)),
    FLOATING_NETWORK_ID("floating_network_id", PropertyKind.STRING,
            PropertyExtractor.direct(FloatingIp::getFloatingNetworkId), "network_id"),
    PROJECT_ID("project_id", PropertyKind.STRING, PropertyExtractor.direct(FloatingIp::getProjectId)),
    FIP_CREATION_DATE("created_at", PropertyKind.DATETIME, PropertyExtractor.direct(FloatingIp::getCreatedAt),
            "fip_creation_date"),
    FIP_LAST_UPDATED_DATE("updated_at", PropertyKind.DATETIME, PropertyExtractor.direct(FloatingIp::getUpdatedAt),
            "fip_last_updated_date"),
    PROJECT_NAME("project_name", PropertyKind.STRING,
            (fip, aux) -> aux.projectField(fip.getProjectId(), Project::getName)),
    PROJECT_EMAIL("project_email", PropertyKind.STRING,
            (fip, aux) -> aux.projectField(fip.getProjectId(), Project::getEmail));

    private final String propertyName;
    private final PropertyKind kind;
    private final PropertyExtractor<FloatingIp> extractor;
    private final List<String> aliases;

    FloatingIpProperties(String propertyName, PropertyKind kind, PropertyExtractor<FloatingIp> extractor,
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
    public Object extract(FloatingIp resource, AuxiliaryData auxiliaryData) {
        return extractor.extract(resource, auxiliaryData);
    }

    public static FloatingIpProperties fromString(String name) {
        return Properties.fromString(FloatingIpProperties.class, name, "floating_ip");
    }
}

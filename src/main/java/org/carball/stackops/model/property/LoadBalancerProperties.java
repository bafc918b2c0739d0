package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.Project;

import java.util.List;

public enum LoadBalancerProperties implements ResourceProperty<LoadBalancer> {
    LB_ID("id", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getId), "lb_id", "loadbalancer_id"),
    LB_NAME("name", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getName), "lb_name"),
    LB_DESCRIPTION("description", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getDescription)),
    LB_PROVIDER("provider", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getProvider)),
    PROVISIONING_STATUS("provisioning_status", PropertyKind.STRING,
            PropertyExtractor.direct(LoadBalancer::getProvisioningStatus)),
    OPERATING_STATUS("operating_status", PropertyKind.STRING,
            PropertyExtractor.direct(LoadBalancer::getOperatingStatus), "status"),
    VIP_ADDRESS("vip_address", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getVipAddress), "vip"),
    FLAVOR_ID("flavor_id", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getFlavorId)),
    PROJECT_ID("project_id", PropertyKind.STRING, PropertyExtractor.direct(LoadBalancer::getProjectId)),
    LB_CREATION_DATE("created_at", PropertyKind.DATETIME, PropertyExtractor.direct(LoadBalancer::getCreatedAt)),
    LB_LAST_UPDATED_DATE("updated_at", PropertyKind.DATETIME, PropertyExtractor.direct(LoadBalancer::getUpdatedAt)),
    PROJECT_NAME("project_name", PropertyKind.STRING,
            (lb, aux) -> aux.projectField(lb.getProjectId(), Project::getName)),
    PROJECT_EMAIL("project_email", PropertyKind.STRING,
            (lb, aux) -> aux.projectField(lb.getProjectId(), Project::getEmail));

    private final String propertyName;
    private final PropertyKind kind;
    private final PropertyExtractor<LoadBalancer> extractor;
    private final List<String> aliases;

    LoadBalancerProperties(String propertyName, PropertyKind kind, PropertyExtractor<LoadBalancer> extractor,
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
    public Object extract(LoadBalancer resource, AuxiliaryData auxiliaryData) {
        return extractor.extract(resource, auxiliaryData);
    }

    public static LoadBalancerProperties fromString(String name) {
        return Properties.fromString(LoadBalancerProperties.class, name, "load_balancer");
    }
}

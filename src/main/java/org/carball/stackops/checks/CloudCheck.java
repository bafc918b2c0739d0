package org.carball.stackops.checks;

import lombok.Getter;
import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.model.preset.QueryPresetsDateTime;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.preset.QueryPresetsString;
import org.carball.stackops.model.property.FloatingIpProperties;
import org.carball.stackops.model.property.LoadBalancerProperties;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.property.ServerProperties;
import org.carball.stackops.model.property.VolumeSnapshotProperties;
import org.carball.stackops.model.resource.CloudResource;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.query.Query;
import org.carball.stackops.query.QueryFactory;

import java.util.List;
import java.util.Map;

/**
 * Named anomaly checks. Each builds one or more queries; every matching record becomes a ticket
 * whose title and body are rendered from the record's values.
 */
@Getter
public enum CloudCheck {

    DELETING_MACHINES("deleting-machines", "Servers stuck deleting",
            "Server {id} has not been updated in more than {threshold} during {status}",
            "The following information may be useful\nServer: {name} ({id})\nProject: {project_id}\n"
                    + "Last updated: {updated_at}") {
        @Override
        public List<Query<?>> buildQueries(QueryFactory factory, CloudClient client, QueryEngineConfig config,
                                           CheckParameters parameters) {
            return List.of(scoped(factory.servers(client), ServerProperties.PROJECT_ID, parameters)
                    .where(QueryPresetsGeneric.EQUAL_TO, ServerProperties.SERVER_STATUS, Map.of("value", "DELETING"))
                    .where(QueryPresetsDateTime.OLDER_THAN_OR_EQUAL, ServerProperties.SERVER_LAST_UPDATED_DATE,
                            Map.of("minutes", config.getDeletingMachineMinutes()))
                    .select(ServerProperties.SERVER_ID, ServerProperties.SERVER_NAME, ServerProperties.SERVER_STATUS,
                            ServerProperties.PROJECT_ID, ServerProperties.SERVER_LAST_UPDATED_DATE));
        }

        @Override
        public String threshold(QueryEngineConfig config, CheckParameters parameters) {
            return config.getDeletingMachineMinutes() + " minutes";
        }
    },

    STALE_SNAPSHOTS("stale-snapshots", "Volume snapshots older than the retention period",
            "Snapshot {id} is older than {threshold}",
            "Snapshot: {name} ({id})\nProject: {project_id}\nSize: {size} GB\nCreated: {created_at}") {
        @Override
        public List<Query<?>> buildQueries(QueryFactory factory, CloudClient client, QueryEngineConfig config,
                                           CheckParameters parameters) {
            return List.of(scoped(factory.volumeSnapshots(client), VolumeSnapshotProperties.PROJECT_ID, parameters)
                    .where(QueryPresetsDateTime.OLDER_THAN, VolumeSnapshotProperties.SNAPSHOT_CREATION_DATE,
                            Map.of("days", parameters.daysOr(config.getStaleSnapshotDays())))
                    .select(VolumeSnapshotProperties.SNAPSHOT_ID, VolumeSnapshotProperties.SNAPSHOT_NAME,
                            VolumeSnapshotProperties.PROJECT_ID, VolumeSnapshotProperties.SNAPSHOT_SIZE,
                            VolumeSnapshotProperties.SNAPSHOT_CREATION_DATE));
        }

        @Override
        public String threshold(QueryEngineConfig config, CheckParameters parameters) {
            return parameters.daysOr(config.getStaleSnapshotDays()) + " days";
        }
    },

    DOWN_FLOATING_IPS("down-floating-ips", "Floating IPs left DOWN",
            "Floating IP {floating_ip_address} has been DOWN for more than {threshold}",
            "Floating IP: {floating_ip_address} ({id})\nProject: {project_id}\nLast updated: {updated_at}") {
        @Override
        public List<Query<?>> buildQueries(QueryFactory factory, CloudClient client, QueryEngineConfig config,
                                           CheckParameters parameters) {
            return List.of(scoped(factory.floatingIps(client), FloatingIpProperties.PROJECT_ID, parameters)
                    .where(QueryPresetsGeneric.EQUAL_TO, FloatingIpProperties.FIP_STATUS, Map.of("value", "DOWN"))
                    .where(QueryPresetsDateTime.OLDER_THAN, FloatingIpProperties.FIP_LAST_UPDATED_DATE,
                            Map.of("days", parameters.daysOr(config.getDownFloatingIpDays())))
                    .select(FloatingIpProperties.FIP_ID, FloatingIpProperties.FLOATING_IP_ADDRESS,
                            FloatingIpProperties.PROJECT_ID, FloatingIpProperties.FIP_LAST_UPDATED_DATE));
        }

        @Override
        public String threshold(QueryEngineConfig config, CheckParameters parameters) {
            return parameters.daysOr(config.getDownFloatingIpDays()) + " days";
        }
    },

    UNHEALTHY_LOAD_BALANCERS("unhealthy-load-balancers", "Load balancers offline or in error",
            "Load balancer {id} is unhealthy ({operating_status}/{provisioning_status})",
            "Load balancer: {name} ({id})\nProject: {project_id}\nVIP: {vip_address}\n"
                    + "Operating status: {operating_status}\nProvisioning status: {provisioning_status}") {
        @Override
        public List<Query<?>> buildQueries(QueryFactory factory, CloudClient client, QueryEngineConfig config,
                                           CheckParameters parameters) {
            // Either condition flags the load balancer, so each gets its own query.
            return List.of(
                    loadBalancers(factory, client, parameters)
                            .where(QueryPresetsString.NOT_ANY_IN, LoadBalancerProperties.OPERATING_STATUS,
                                    Map.of("values", List.of("ONLINE"))),
                    loadBalancers(factory, client, parameters)
                            .where(QueryPresetsGeneric.EQUAL_TO, LoadBalancerProperties.PROVISIONING_STATUS,
                                    Map.of("value", "ERROR")));
        }
    };

    private final String name;
    private final String description;
    private final String titleTemplate;
    private final String bodyTemplate;

    CloudCheck(String name, String description, String titleTemplate, String bodyTemplate) {
        this.name = name;
        this.description = description;
        this.titleTemplate = titleTemplate;
        this.bodyTemplate = bodyTemplate;
    }

    /**
     * Queries whose matches, unioned by id, are the resources to raise tickets for.
     */
    public abstract List<Query<?>> buildQueries(QueryFactory factory, CloudClient client, QueryEngineConfig config,
                                                CheckParameters parameters);

    /**
     * Human-readable threshold substituted for {@code {threshold}} in the templates.
     */
    public String threshold(QueryEngineConfig config, CheckParameters parameters) {
        return "";
    }

    /**
     * Finds a check by name (case-insensitive).
     */
    public static CloudCheck fromName(String name) {
        for (CloudCheck check : values()) {
            if (check.getName().equalsIgnoreCase(name) || check.name().equalsIgnoreCase(name)) {
                return check;
            }
        }
        throw new IllegalArgumentException("Unknown check: " + name + ". Available checks: " + getAvailableChecks());
    }

    public static String getAvailableChecks() {
        StringBuilder sb = new StringBuilder();
        for (CloudCheck check : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(check.getName());
        }
        return sb.toString();
    }

    public static String getCheckHelp() {
        StringBuilder help = new StringBuilder("Available Checks:\n\n");
        for (CloudCheck check : values()) {
            help.append(String.format("  %-26s %s\n", check.getName(), check.getDescription()));
        }
        help.append("\nUse --check <name> [--days <num>] [--project <id>] to run a check.\n");
        return help.toString();
    }

    private static <R extends CloudResource> Query<R> scoped(Query<R> query, ResourceProperty<R> projectProperty,
                                                             CheckParameters parameters) {
        if (parameters.getProjectId() != null) {
            query.where(QueryPresetsGeneric.EQUAL_TO, projectProperty, Map.of("value", parameters.getProjectId()));
        }
        return query;
    }

    private static Query<LoadBalancer> loadBalancers(QueryFactory factory, CloudClient client,
                                                     CheckParameters parameters) {
        return scoped(factory.loadBalancers(client), LoadBalancerProperties.PROJECT_ID, parameters)
                .select(LoadBalancerProperties.LB_ID, LoadBalancerProperties.LB_NAME, LoadBalancerProperties.PROJECT_ID,
                        LoadBalancerProperties.VIP_ADDRESS, LoadBalancerProperties.OPERATING_STATUS,
                        LoadBalancerProperties.PROVISIONING_STATUS);
    }
}

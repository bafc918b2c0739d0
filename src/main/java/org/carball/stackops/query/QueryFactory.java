package org.carball.stackops.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.exception.InvalidArgumentException;
import org.carball.stackops.model.query.FilterSpec;
import org.carball.stackops.model.query.QueryRequest;
import org.carball.stackops.model.query.SortOrder;
import org.carball.stackops.model.resource.CloudResource;
import org.carball.stackops.model.resource.FloatingIp;
import org.carball.stackops.model.resource.LoadBalancer;
import org.carball.stackops.model.resource.Project;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.model.resource.Server;
import org.carball.stackops.model.resource.User;
import org.carball.stackops.model.resource.VolumeSnapshot;
import org.carball.stackops.query.handler.HandlerConsistencyCheck;
import org.carball.stackops.query.mapping.FloatingIpQueryMapping;
import org.carball.stackops.query.mapping.LoadBalancerQueryMapping;
import org.carball.stackops.query.mapping.ProjectQueryMapping;
import org.carball.stackops.query.mapping.QueryMapping;
import org.carball.stackops.query.mapping.ServerQueryMapping;
import org.carball.stackops.query.mapping.UserQueryMapping;
import org.carball.stackops.query.mapping.VolumeSnapshotQueryMapping;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point of the engine: the closed table of resource type mappings. The handler
 * tables of every mapping are checked for consistency when the factory is created.
 */
@Slf4j
public class QueryFactory {

    private final QueryEngineConfig config;
    private final ServerQueryMapping serverMapping;
    private final FloatingIpQueryMapping floatingIpMapping;
    private final LoadBalancerQueryMapping loadBalancerMapping;
    private final VolumeSnapshotQueryMapping volumeSnapshotMapping;
    private final ProjectQueryMapping projectMapping;
    private final UserQueryMapping userMapping;
    private final Map<ResourceType, QueryMapping<?>> mappings = new EnumMap<>(ResourceType.class);

    public QueryFactory() {
        this(QueryEngineConfig.defaults(), Clock.systemUTC());
    }

    public QueryFactory(QueryEngineConfig config, Clock clock) {
        this.config = config;
        this.serverMapping = register(new ServerQueryMapping(clock));
        this.floatingIpMapping = register(new FloatingIpQueryMapping(clock));
        this.loadBalancerMapping = register(new LoadBalancerQueryMapping(clock));
        this.volumeSnapshotMapping = register(new VolumeSnapshotQueryMapping(clock));
        this.projectMapping = register(new ProjectQueryMapping(clock));
        this.userMapping = register(new UserQueryMapping(clock));

        for (QueryMapping<?> mapping : mappings.values()) {
            HandlerConsistencyCheck.verify(mapping.getResourceType().getDisplayName(),
                    mapping.getClientSideHandlers(), mapping.getServerSideHandler());
        }
        log.debug("Query factory ready for {} resource types", mappings.size());
    }

    private <M extends QueryMapping<?>> M register(M mapping) {
        mappings.put(mapping.getResourceType(), mapping);
        return mapping;
    }

    public Map<ResourceType, QueryMapping<?>> getMappings() {
        return Collections.unmodifiableMap(mappings);
    }

    public QueryMapping<?> getMapping(ResourceType type) {
        QueryMapping<?> mapping = mappings.get(type);
        if (mapping == null) {
            throw new IllegalArgumentException("No query mapping for resource type: " + type);
        }
        return mapping;
    }

    public QueryEngineConfig getConfig() {
        return config;
    }

    public Query<?> create(ResourceType type, CloudClient client) {
        return newQuery(getMapping(type), client);
    }

    public Query<Server> servers(CloudClient client) {
        return newQuery(serverMapping, client);
    }

    public Query<FloatingIp> floatingIps(CloudClient client) {
        return newQuery(floatingIpMapping, client);
    }

    public Query<LoadBalancer> loadBalancers(CloudClient client) {
        return newQuery(loadBalancerMapping, client);
    }

    public Query<VolumeSnapshot> volumeSnapshots(CloudClient client) {
        return newQuery(volumeSnapshotMapping, client);
    }

    public Query<Project> projects(CloudClient client) {
        return newQuery(projectMapping, client);
    }

    public Query<User> users(CloudClient client) {
        return newQuery(userMapping, client);
    }

    /**
     * Builds a query from a textual request and runs it.
     */
    public QueryResult execute(QueryRequest request, CloudClient client) {
        return toQuery(request, client).run();
    }

    public Query<?> toQuery(QueryRequest request, CloudClient client) {
        if (request.getResourceType() == null || request.getResourceType().isBlank()) {
            throw new InvalidArgumentException("Query request has no resource_type");
        }
        ResourceType type;
        try {
            type = ResourceType.fromName(request.getResourceType());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException(e.getMessage(), e);
        }

        Query<?> query = create(type, client);
        if (request.getFilters() != null) {
            for (FilterSpec filter : request.getFilters()) {
                query.where(filter.getPreset(), filter.getProperty(), filter.getArgs());
            }
        }
        if (request.getRawFilters() != null && !request.getRawFilters().isEmpty()) {
            query.whereRaw(request.getRawFilters());
        }
        if (request.getProperties() != null && !request.getProperties().isEmpty()) {
            query.select(request.getProperties().toArray(new String[0]));
        }
        if (request.getSortBy() != null && !request.getSortBy().isBlank()) {
            SortOrder order;
            try {
                order = SortOrder.fromName(request.getSortOrder());
            } catch (IllegalArgumentException e) {
                throw new InvalidArgumentException(e.getMessage(), e);
            }
            query.sortBy(request.getSortBy(), order);
        }
        if (request.getGroupBy() != null && !request.getGroupBy().isBlank()) {
            query.groupBy(request.getGroupBy());
        }
        return query;
    }

    private <R extends CloudResource> Query<R> newQuery(QueryMapping<R> mapping, CloudClient client) {
        return new Query<>(mapping, client, config);
    }
}

package org.carball.stackops.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.exception.LookupFailureException;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.query.SortOrder;
import org.carball.stackops.model.resource.CloudResource;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.query.mapping.QueryMapping;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A query over one resource type, composed of a {@link QueryBuilder}, a {@link QueryRunner}
 * and a {@link QueryOutput}. Each {@link #run()} is an independent execution with its own
 * lookup cache; nothing is kept between runs.
 *
 * <pre>
 * QueryResult result = factory.servers(client)
 *         .where(QueryPresetsString.NOT_ANY_IN, ServerProperties.SERVER_STATUS, Map.of("values", List.of("ACTIVE")))
 *         .select(ServerProperties.SERVER_ID, ServerProperties.SERVER_STATUS)
 *         .run();
 * </pre>
 */
@Slf4j
public class Query<R extends CloudResource> {

    private final QueryMapping<R> mapping;
    private final CloudClient client;
    private final QueryBuilder<R> builder;
    private final QueryRunner<R> runner;
    private final QueryOutput<R> output;

    public Query(QueryMapping<R> mapping, CloudClient client, QueryEngineConfig config) {
        this.mapping = mapping;
        this.client = client;
        this.builder = new QueryBuilder<>(mapping, config);
        this.runner = new QueryRunner<>(mapping.selectLister(client), config.isVerifyServerSideFilters());
        this.output = new QueryOutput<>(mapping);
    }

    public Query<R> where(QueryPresets preset, ResourceProperty<R> property, Map<String, Object> arguments) {
        builder.where(preset, property, arguments);
        return this;
    }

    public Query<R> where(String preset, String property, Map<String, Object> arguments) {
        builder.where(preset, property, arguments);
        return this;
    }

    public Query<R> whereRaw(Map<String, Object> filters) {
        builder.whereRaw(filters);
        return this;
    }

    @SafeVarargs
    public final Query<R> select(ResourceProperty<R>... properties) {
        output.select(properties);
        return this;
    }

    public Query<R> select(String... properties) {
        output.select(properties);
        return this;
    }

    public Query<R> selectAll() {
        output.selectAll();
        return this;
    }

    public Query<R> sortBy(ResourceProperty<R> property, SortOrder order) {
        output.sortBy(property, order);
        return this;
    }

    public Query<R> sortBy(String property, SortOrder order) {
        output.sortBy(property, order);
        return this;
    }

    public Query<R> groupBy(ResourceProperty<R> property) {
        output.groupBy(property);
        return this;
    }

    public Query<R> groupBy(String property) {
        output.groupBy(property);
        return this;
    }

    public QueryPlan<R> getPlan() {
        return builder.buildPlan();
    }

    public ResourceType getResourceType() {
        return mapping.getResourceType();
    }

    public QueryResult run() {
        QueryPlan<R> plan = builder.buildPlan();
        LookupContext lookups = LookupContext.forClient(client);
        List<R> matches = runner.run(plan, lookups);
        return finish(matches, lookups);
    }

    /**
     * Filters the given resources locally instead of listing them from the cloud.
     */
    public QueryResult runOn(Collection<R> candidates) {
        QueryPlan<R> plan = builder.buildPlan();
        LookupContext lookups = LookupContext.forClient(client);
        List<R> matches = runner.runOn(plan, candidates, lookups);
        return finish(matches, lookups);
    }

    /**
     * Matching resources themselves, for callers that act on them rather than render them.
     */
    public List<R> runForResources() {
        return runner.run(builder.buildPlan(), LookupContext.forClient(client));
    }

    private QueryResult finish(List<R> matches, LookupContext lookups) {
        QueryResult result = output.project(matches, lookups);
        for (LookupFailureException failure : lookups.getFailures()) {
            result.addWarning(failure.getMessage());
        }
        log.info("Query on {} returned {} record(s){}", mapping.getResourceType().getCollectionName(), result.size(),
                result.isGrouped() ? " in " + result.toGroups().size() + " group(s)" : "");
        return result;
    }
}

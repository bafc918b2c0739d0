package org.carball.stackops.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.property.AuxiliaryData;
import org.carball.stackops.model.query.FilterCondition;
import org.carball.stackops.model.resource.CloudResource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Executes a {@link QueryPlan}: one listing call per native filter alternative, then the
 * local conditions. Lister exceptions are not caught; a failed listing fails the run.
 */
@Slf4j
public class QueryRunner<R extends CloudResource> {

    private final ResourceLister<R> lister;
    private final boolean verifyServerSideFilters;

    public QueryRunner(ResourceLister<R> lister, boolean verifyServerSideFilters) {
        this.lister = lister;
        this.verifyServerSideFilters = verifyServerSideFilters;
    }

    public List<R> run(QueryPlan<R> plan, AuxiliaryData auxiliaryData) {
        List<R> candidates = list(plan);
        List<FilterCondition<R>> conditions = verifyServerSideFilters
                ? plan.getConditions()
                : plan.getClientSideConditions();
        List<R> matches = filter(candidates, conditions, auxiliaryData);
        log.debug("{} of {} listed {} resource(s) matched", matches.size(), candidates.size(),
                plan.getResourceType().getDisplayName());
        return matches;
    }

    /**
     * Runs every condition locally against caller-supplied candidates; nothing is listed.
     */
    public List<R> runOn(QueryPlan<R> plan, Collection<R> candidates, AuxiliaryData auxiliaryData) {
        List<R> matches = filter(deduplicate(candidates), plan.getConditions(), auxiliaryData);
        log.debug("{} of {} supplied {} resource(s) matched", matches.size(), candidates.size(),
                plan.getResourceType().getDisplayName());
        return matches;
    }

    private List<R> list(QueryPlan<R> plan) {
        List<R> listed = new ArrayList<>();
        for (Map<String, Object> filters : plan.getListingFilters()) {
            log.debug("Listing {} with filters {}", plan.getResourceType().getCollectionName(), filters);
            List<R> page = lister.list(filters);
            if (page != null) {
                listed.addAll(page);
            }
        }
        return deduplicate(listed);
    }

    private List<R> deduplicate(Collection<R> resources) {
        Set<String> seen = new HashSet<>();
        List<R> unique = new ArrayList<>();
        for (R resource : resources) {
            if (resource.getId() == null || seen.add(resource.getId())) {
                unique.add(resource);
            }
        }
        return unique;
    }

    private List<R> filter(List<R> candidates, List<FilterCondition<R>> conditions, AuxiliaryData auxiliaryData) {
        List<R> matches = new ArrayList<>();
        for (R candidate : candidates) {
            if (matchesAll(candidate, conditions, auxiliaryData)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    private boolean matchesAll(R candidate, List<FilterCondition<R>> conditions, AuxiliaryData auxiliaryData) {
        for (FilterCondition<R> condition : conditions) {
            if (!condition.test(candidate, auxiliaryData)) {
                return false;
            }
        }
        return true;
    }
}

package org.carball.stackops.query;

import lombok.Getter;
import org.carball.stackops.model.query.FilterCondition;
import org.carball.stackops.model.resource.ResourceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable result of building a query. The listing is called once per native filter
 * alternative; every condition is listed, pushed-down ones flagged as server-side.
 */
@Getter
public final class QueryPlan<R> {

    private final ResourceType resourceType;
    private final List<Map<String, Object>> nativeFilterAlternatives;
    private final Map<String, Object> rawFilters;
    private final List<FilterCondition<R>> conditions;

    QueryPlan(ResourceType resourceType, List<Map<String, Object>> nativeFilterAlternatives,
              Map<String, Object> rawFilters, List<FilterCondition<R>> conditions) {
        this.resourceType = resourceType;
        List<Map<String, Object>> alternatives = new ArrayList<>();
        for (Map<String, Object> alternative : nativeFilterAlternatives) {
            alternatives.add(Collections.unmodifiableMap(new LinkedHashMap<>(alternative)));
        }
        if (alternatives.isEmpty()) {
            alternatives.add(Collections.emptyMap());
        }
        this.nativeFilterAlternatives = Collections.unmodifiableList(alternatives);
        this.rawFilters = Collections.unmodifiableMap(new LinkedHashMap<>(rawFilters));
        this.conditions = List.copyOf(conditions);
    }

    /**
     * The exact filter maps handed to the lister: each alternative with the raw filters merged in.
     */
    public List<Map<String, Object>> getListingFilters() {
        return nativeFilterAlternatives.stream()
                .map(alternative -> {
                    Map<String, Object> merged = new LinkedHashMap<>(alternative);
                    merged.putAll(rawFilters);
                    return Collections.unmodifiableMap(merged);
                })
                .collect(Collectors.toList());
    }

    public List<FilterCondition<R>> getClientSideConditions() {
        return conditions.stream().filter(condition -> !condition.isServerSide()).collect(Collectors.toList());
    }

    public List<FilterCondition<R>> getServerSideConditions() {
        return conditions.stream().filter(FilterCondition::isServerSide).collect(Collectors.toList());
    }

    public int getListingCallCount() {
        return nativeFilterAlternatives.size();
    }

    public String describe() {
        StringBuilder description = new StringBuilder();
        description.append(resourceType.getDisplayName()).append(": ")
                .append(getListingCallCount()).append(" listing call(s) with ").append(getListingFilters());
        for (FilterCondition<R> condition : conditions) {
            description.append("\n  ").append(condition.isServerSide() ? "[server] " : "[client] ")
                    .append(condition.describe());
        }
        return description.toString();
    }
}

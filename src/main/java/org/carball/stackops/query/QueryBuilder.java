package org.carball.stackops.query;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.config.QueryEngineConfig;
import org.carball.stackops.exception.UnknownPropertyException;
import org.carball.stackops.exception.UnsupportedPresetException;
import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.query.FilterCondition;
import org.carball.stackops.model.resource.CloudResource;
import org.carball.stackops.query.handler.ClientSideHandler;
import org.carball.stackops.query.handler.FilterArguments;
import org.carball.stackops.query.handler.ServerSideHandler;
import org.carball.stackops.query.mapping.QueryMapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Accumulates filters for one resource type. Every filter is validated and compiled
 * when it is added; those the listing API can apply natively are also folded into
 * the native filter alternatives.
 */
@Slf4j
public class QueryBuilder<R extends CloudResource> {

    private final QueryMapping<R> mapping;
    private final QueryEngineConfig config;
    private final List<FilterCondition<R>> conditions = new ArrayList<>();
    // native keys each condition contributed, index-aligned with conditions
    private final List<Set<String>> pushedKeys = new ArrayList<>();
    private final Map<String, Object> rawFilters = new LinkedHashMap<>();
    private List<Map<String, Object>> nativeFilters = List.of(Collections.emptyMap());

    public QueryBuilder(QueryMapping<R> mapping, QueryEngineConfig config) {
        this.mapping = mapping;
        this.config = config;
    }

    public QueryBuilder<R> where(QueryPresets preset, ResourceProperty<R> property, Map<String, Object> arguments) {
        String resourceType = mapping.getResourceType().getDisplayName();
        if (!mapping.getProperties().contains(property)) {
            throw new UnknownPropertyException(property.getPropertyName(), resourceType);
        }
        if (!preset.getKind().accepts(property.getKind())) {
            throw new UnsupportedPresetException(String.format(
                    "Preset '%s' cannot be applied to %s property '%s'",
                    preset.qualifiedName(), property.getKind().name().toLowerCase(), property.getPropertyName()));
        }

        ClientSideHandler<?> handler = mapping.getClientSideHandlers().forPreset(preset)
                .orElseThrow(() -> new UnsupportedPresetException(
                        "No client-side handler for preset '" + preset.qualifiedName() + "'"));
        if (!handler.checkSupported(preset, property)) {
            throw new UnsupportedPresetException(String.format(
                    "Preset '%s' is not supported for property '%s' of %s",
                    preset.qualifiedName(), property.getPropertyName(), resourceType));
        }

        Map<String, Object> effectiveArguments = withDefaults(preset, arguments);
        Predicate<Object> predicate = handler.getFilterFunction(preset, property, effectiveArguments);
        Set<String> keys = tryPushDown(preset, property, effectiveArguments);
        boolean pushed = !keys.isEmpty();

        conditions.add(FilterCondition.<R>builder()
                .property(property)
                .preset(preset)
                .arguments(effectiveArguments)
                .predicate(predicate)
                .serverSide(pushed)
                .build());
        pushedKeys.add(keys);
        log.debug("Added {} filter {} {} on {}", pushed ? "server-side" : "client-side",
                preset.qualifiedName(), effectiveArguments, property.getPropertyName());
        return this;
    }

    /**
     * Textual variant, resolving the preset and property names first.
     */
    public QueryBuilder<R> where(String presetName, String propertyName, Map<String, Object> arguments) {
        ResourceProperty<R> property = mapping.resolveProperty(propertyName);
        QueryPresets preset = QueryPresets.fromString(presetName);
        return where(preset, property, arguments);
    }

    /**
     * Native filters handed to every listing call as-is, without local verification.
     * A pushed-down condition whose native key is overridden here is always checked locally.
     */
    public QueryBuilder<R> whereRaw(Map<String, Object> filters) {
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            if (overridesPushedKey(entry.getKey(), entry.getValue())) {
                log.warn("Raw filter '{}' overrides a pushed-down filter on the same key", entry.getKey());
                demoteConditionsUsing(entry.getKey());
            }
            rawFilters.put(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public QueryPlan<R> buildPlan() {
        QueryPlan<R> plan = new QueryPlan<>(mapping.getResourceType(), nativeFilters, rawFilters, conditions);
        log.debug("Built plan for {}", plan.describe());
        return plan;
    }

    public QueryMapping<R> getMapping() {
        return mapping;
    }

    private Map<String, Object> withDefaults(QueryPresets preset, Map<String, Object> arguments) {
        Map<String, Object> effective = arguments == null ? new LinkedHashMap<>() : new LinkedHashMap<>(arguments);
        String format = config.getDateTimeFormat();
        if (preset.getKind() == PresetKind.DATETIME && !effective.containsKey(FilterArguments.FORMAT)
                && format != null && !format.isBlank()) {
            effective.put(FilterArguments.FORMAT, format);
        }
        return effective;
    }

    private boolean overridesPushedKey(String key, Object value) {
        for (Map<String, Object> alternative : nativeFilters) {
            if (alternative.containsKey(key) && !Objects.equals(alternative.get(key), value)) {
                return true;
            }
        }
        return false;
    }

    private void demoteConditionsUsing(String key) {
        for (int i = 0; i < conditions.size(); i++) {
            FilterCondition<R> condition = conditions.get(i);
            if (condition.isServerSide() && pushedKeys.get(i).contains(key)) {
                conditions.set(i, condition.toBuilder().serverSide(false).build());
                log.debug("Checking {} on {} client-side: its native key '{}' is overridden",
                        condition.getPreset().qualifiedName(), condition.getProperty().getPropertyName(), key);
            }
        }
    }

    /**
     * Returns the native keys the condition was pushed down with, or an empty set when it stays client-side.
     */
    private Set<String> tryPushDown(QueryPresets preset, ResourceProperty<R> property, Map<String, Object> arguments) {
        ServerSideHandler serverSide = mapping.getServerSideHandler();
        if (!config.isServerSideFilters() || !serverSide.checkSupported(preset, property)) {
            return Set.of();
        }

        List<Map<String, Object>> additions = serverSide.getFilters(preset, property, arguments);
        List<Map<String, Object>> combined = new ArrayList<>();
        Set<String> keys = new LinkedHashSet<>();
        for (Map<String, Object> existing : nativeFilters) {
            for (Map<String, Object> addition : additions) {
                Map<String, Object> merged = merge(existing, addition);
                if (merged == null) {
                    log.debug("Keeping {} on {} client-side: native filter keys {} already in use",
                            preset.qualifiedName(), property.getPropertyName(), addition.keySet());
                    return Set.of();
                }
                combined.add(merged);
                keys.addAll(addition.keySet());
            }
        }

        if (combined.size() > config.getMaxListingCalls()) {
            log.debug("Keeping {} on {} client-side: would need {} listing calls (max {})",
                    preset.qualifiedName(), property.getPropertyName(), combined.size(), config.getMaxListingCalls());
            return Set.of();
        }
        if (keys.isEmpty()) {
            return Set.of();
        }
        nativeFilters = combined;
        return keys;
    }

    private Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> addition) {
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        for (Map.Entry<String, Object> entry : addition.entrySet()) {
            String key = entry.getKey();
            boolean clashesPushed = existing.containsKey(key) && !Objects.equals(existing.get(key), entry.getValue());
            boolean clashesRaw = rawFilters.containsKey(key) && !Objects.equals(rawFilters.get(key), entry.getValue());
            if (clashesPushed || clashesRaw) {
                return null;
            }
            merged.put(key, entry.getValue());
        }
        return merged;
    }
}

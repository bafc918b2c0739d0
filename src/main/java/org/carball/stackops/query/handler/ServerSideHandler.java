package org.carball.stackops.query.handler;

import org.carball.stackops.exception.UnsupportedPresetException;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.QueryProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The (preset, property) pairs a resource type's listing call can filter natively.
 * Pushdown is an optimisation only; every pair here must also be client-side supported.
 */
public class ServerSideHandler implements PresetHandler {

    private final Map<QueryPresets, Map<QueryProperty, ServerSideFilterFunction>> filterMappings;

    private ServerSideHandler(Map<QueryPresets, Map<QueryProperty, ServerSideFilterFunction>> filterMappings) {
        this.filterMappings = filterMappings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ServerSideHandler none() {
        return new ServerSideHandler(Collections.emptyMap());
    }

    @Override
    public boolean checkSupported(QueryPresets preset, QueryProperty property) {
        return filterMappings.getOrDefault(preset, Collections.emptyMap()).containsKey(property);
    }

    public List<Map<String, Object>> getFilters(QueryPresets preset, QueryProperty property,
                                                Map<String, Object> arguments) {
        ServerSideFilterFunction function = filterMappings.getOrDefault(preset, Collections.emptyMap()).get(property);
        if (function == null) {
            throw new UnsupportedPresetException(String.format(
                    "Preset '%s' cannot be applied server-side to property '%s'",
                    preset.qualifiedName(), property.getPropertyName()));
        }
        return function.apply(FilterArguments.of(arguments));
    }

    public Set<QueryPresets> getSupportedPresets() {
        return Collections.unmodifiableSet(filterMappings.keySet());
    }

    public Set<QueryProperty> getSupportedProperties(QueryPresets preset) {
        return Collections.unmodifiableSet(filterMappings.getOrDefault(preset, Collections.emptyMap()).keySet());
    }

    public static final class Builder {
        private final Map<QueryPresets, Map<QueryProperty, ServerSideFilterFunction>> filterMappings =
                new LinkedHashMap<>();

        public Builder map(QueryPresets preset, QueryProperty property, ServerSideFilterFunction function) {
            filterMappings.computeIfAbsent(preset, p -> new LinkedHashMap<>()).put(property, function);
            return this;
        }

        public ServerSideHandler build() {
            Map<QueryPresets, Map<QueryProperty, ServerSideFilterFunction>> copy = new LinkedHashMap<>();
            filterMappings.forEach((preset, functions) ->
                    copy.put(preset, Collections.unmodifiableMap(new LinkedHashMap<>(functions))));
            return new ServerSideHandler(Collections.unmodifiableMap(copy));
        }
    }
}

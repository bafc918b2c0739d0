package org.carball.stackops.query.handler;

import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.QueryProperty;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which properties a resource type opts in for, per preset. Anything not listed is unsupported.
 */
public final class PresetPropertyMappings {

    private final Map<QueryPresets, Set<QueryProperty>> mappings;

    private PresetPropertyMappings(Map<QueryPresets, Set<QueryProperty>> mappings) {
        this.mappings = mappings;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PresetPropertyMappings empty() {
        return new PresetPropertyMappings(Collections.emptyMap());
    }

    public boolean supports(QueryPresets preset, QueryProperty property) {
        return mappings.getOrDefault(preset, Collections.emptySet()).contains(property);
    }

    public Set<QueryPresets> presets() {
        return Collections.unmodifiableSet(mappings.keySet());
    }

    public Set<QueryProperty> propertiesFor(QueryPresets preset) {
        return Collections.unmodifiableSet(mappings.getOrDefault(preset, Collections.emptySet()));
    }

    public static final class Builder {
        private final Map<QueryPresets, Set<QueryProperty>> mappings = new LinkedHashMap<>();

        public Builder map(QueryPresets preset, QueryProperty... properties) {
            return map(preset, Arrays.asList(properties));
        }

        public Builder map(QueryPresets preset, Collection<? extends QueryProperty> properties) {
            mappings.computeIfAbsent(preset, p -> new LinkedHashSet<>()).addAll(properties);
            return this;
        }

        public Builder mapEach(Collection<? extends QueryPresets> presets, Collection<? extends QueryProperty> properties) {
            presets.forEach(preset -> map(preset, properties));
            return this;
        }

        public PresetPropertyMappings build() {
            Map<QueryPresets, Set<QueryProperty>> copy = new LinkedHashMap<>();
            mappings.forEach((preset, properties) ->
                    copy.put(preset, Collections.unmodifiableSet(new LinkedHashSet<>(properties))));
            return new PresetPropertyMappings(Collections.unmodifiableMap(copy));
        }
    }
}

package org.carball.stackops.query.handler;

import org.carball.stackops.exception.UnsupportedPresetException;
import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.QueryProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Evaluates the presets of one kind locally, against a single property value.
 * Each subclass registers a filter factory per preset; the resource type decides,
 * through its {@link PresetPropertyMappings}, which properties each preset may be used on.
 *
 * @param <P> preset enumeration handled
 */
public abstract class ClientSideHandler<P extends Enum<P> & QueryPresets> implements PresetHandler {

    private final PresetPropertyMappings propertyMappings;
    private final Map<P, FilterFactory> filterFactories = new LinkedHashMap<>();

    protected ClientSideHandler(PresetPropertyMappings propertyMappings) {
        this.propertyMappings = propertyMappings;
    }

    public abstract PresetKind getKind();

    protected final void register(P preset, FilterFactory factory) {
        filterFactories.put(preset, factory);
    }

    public boolean handles(QueryPresets preset) {
        return preset != null && preset.getKind() == getKind() && filterFactories.containsKey(preset);
    }

    @Override
    public boolean checkSupported(QueryPresets preset, QueryProperty property) {
        return handles(preset) && propertyMappings.supports(preset, property);
    }

    public Set<P> getSupportedPresets() {
        return Collections.unmodifiableSet(filterFactories.keySet());
    }

    /**
     * Compiles the predicate for a preset applied to a property. Argument problems
     * surface here, so callers fail when the filter is added rather than when it runs.
     */
    public Predicate<Object> getFilterFunction(QueryPresets preset, QueryProperty property,
                                               Map<String, Object> arguments) {
        if (!checkSupported(preset, property)) {
            throw new UnsupportedPresetException(String.format(
                    "Preset '%s' is not supported for property '%s'", preset.qualifiedName(), property.getPropertyName()));
        }
        return factoryFor(preset).create(FilterArguments.of(arguments));
    }

    /**
     * Applies a preset directly to a value.
     */
    public boolean evaluate(QueryPresets preset, Object value, Map<String, Object> arguments) {
        return factoryFor(preset).create(FilterArguments.of(arguments)).test(value);
    }

    private FilterFactory factoryFor(QueryPresets preset) {
        if (!handles(preset)) {
            throw new UnsupportedPresetException(String.format(
                    "Preset '%s' is not handled by the %s handler", preset, getKind().getDisplayName()));
        }
        return filterFactories.get(preset);
    }
}

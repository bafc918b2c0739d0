package org.carball.stackops.query.handler;

import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.QueryProperty;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handler registry of one resource type: exactly one client-side handler per preset kind.
 */
public final class ClientSideHandlers {

    private final Map<PresetKind, ClientSideHandler<?>> handlers = new EnumMap<>(PresetKind.class);

    public ClientSideHandlers(ClientSideHandlerGeneric generic, ClientSideHandlerInteger integer,
                              ClientSideHandlerString string, ClientSideHandlerDateTime dateTime) {
        handlers.put(PresetKind.GENERIC, generic);
        handlers.put(PresetKind.INTEGER, integer);
        handlers.put(PresetKind.STRING, string);
        handlers.put(PresetKind.DATETIME, dateTime);
    }

    public ClientSideHandler<?> forKind(PresetKind kind) {
        return handlers.get(kind);
    }

    public Optional<ClientSideHandler<?>> forPreset(QueryPresets preset) {
        return Optional.<ClientSideHandler<?>>ofNullable(handlers.get(preset.getKind()))
                .filter(handler -> handler.handles(preset));
    }

    public boolean checkSupported(QueryPresets preset, QueryProperty property) {
        return forPreset(preset).map(handler -> handler.checkSupported(preset, property)).orElse(false);
    }

    public List<ClientSideHandler<?>> toList() {
        return List.copyOf(handlers.values());
    }
}

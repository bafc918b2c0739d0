package org.carball.stackops.query.mapping;

import org.carball.stackops.cloud.CloudClient;
import org.carball.stackops.cloud.ResourceLister;
import org.carball.stackops.model.preset.QueryPresetsDateTime;
import org.carball.stackops.model.preset.QueryPresetsGeneric;
import org.carball.stackops.model.preset.QueryPresetsInteger;
import org.carball.stackops.model.preset.QueryPresetsString;
import org.carball.stackops.model.property.PropertyKind;
import org.carball.stackops.model.property.ResourceProperty;
import org.carball.stackops.model.resource.CloudResource;
import org.carball.stackops.model.resource.ResourceType;
import org.carball.stackops.query.handler.ClientSideHandlerDateTime;
import org.carball.stackops.query.handler.ClientSideHandlerGeneric;
import org.carball.stackops.query.handler.ClientSideHandlerInteger;
import org.carball.stackops.query.handler.ClientSideHandlerString;
import org.carball.stackops.query.handler.ClientSideHandlers;
import org.carball.stackops.query.handler.PresetPropertyMappings;
import org.carball.stackops.query.handler.ServerSideHandler;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything the engine needs to know about one resource type: its properties,
 * which presets apply to which properties client-side, which of those can be
 * pushed down to the listing call, and where to list it from.
 */
public abstract class QueryMapping<R extends CloudResource> {

    private final Clock clock;
    private ClientSideHandlers clientSideHandlers;
    private ServerSideHandler serverSideHandler;

    protected QueryMapping(Clock clock) {
        this.clock = clock;
    }

    public abstract ResourceType getResourceType();

    public abstract List<ResourceProperty<R>> getProperties();

    public abstract ResourceProperty<R> resolveProperty(String name);

    /**
     * Output columns used when the caller selects none.
     */
    public abstract List<ResourceProperty<R>> getDefaultOutputProperties();

    public abstract ResourceLister<R> selectLister(CloudClient client);

    protected abstract PresetPropertyMappings genericMappings();

    protected abstract PresetPropertyMappings stringMappings();

    protected abstract PresetPropertyMappings dateTimeMappings();

    protected PresetPropertyMappings integerMappings() {
        return PresetPropertyMappings.empty();
    }

    protected abstract ServerSideHandler buildServerSideHandler(Clock clock);

    public Clock getClock() {
        return clock;
    }

    public synchronized ClientSideHandlers getClientSideHandlers() {
        if (clientSideHandlers == null) {
            clientSideHandlers = new ClientSideHandlers(
                    new ClientSideHandlerGeneric(genericMappings()),
                    new ClientSideHandlerInteger(integerMappings()),
                    new ClientSideHandlerString(stringMappings()),
                    new ClientSideHandlerDateTime(dateTimeMappings(), clock));
        }
        return clientSideHandlers;
    }

    public synchronized ServerSideHandler getServerSideHandler() {
        if (serverSideHandler == null) {
            serverSideHandler = buildServerSideHandler(clock);
        }
        return serverSideHandler;
    }

    protected List<ResourceProperty<R>> propertiesOfKind(PropertyKind kind) {
        return getProperties().stream()
                .filter(property -> property.getKind() == kind)
                .collect(Collectors.toList());
    }

    protected PresetPropertyMappings allGenericPresetsOn(List<ResourceProperty<R>> properties) {
        return PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsGeneric.values()), properties)
                .build();
    }

    protected PresetPropertyMappings allStringPresetsOn(List<ResourceProperty<R>> properties) {
        return PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsString.values()), properties)
                .build();
    }

    protected PresetPropertyMappings allDateTimePresetsOn(List<ResourceProperty<R>> properties) {
        return PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsDateTime.values()), properties)
                .build();
    }

    protected PresetPropertyMappings allIntegerPresetsOn(List<ResourceProperty<R>> properties) {
        return PresetPropertyMappings.builder()
                .mapEach(Arrays.asList(QueryPresetsInteger.values()), properties)
                .build();
    }
}

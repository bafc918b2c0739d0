package org.carball.stackops.query.handler;

import lombok.extern.slf4j.Slf4j;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.QueryProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Verifies that the server-side support table of a resource type is a subset of its
 * client-side one, so any condition can still be resolved locally.
 */
@Slf4j
public final class HandlerConsistencyCheck {

    private HandlerConsistencyCheck() {
    }

    public static List<String> findViolations(ClientSideHandlers clientSide, ServerSideHandler serverSide) {
        List<String> violations = new ArrayList<>();
        for (QueryPresets preset : serverSide.getSupportedPresets()) {
            for (QueryProperty property : serverSide.getSupportedProperties(preset)) {
                if (!clientSide.checkSupported(preset, property)) {
                    violations.add(preset.qualifiedName() + " on " + property.getPropertyName());
                }
            }
        }
        return violations;
    }

    public static void verify(String resourceType, ClientSideHandlers clientSide, ServerSideHandler serverSide) {
        List<String> violations = findViolations(clientSide, serverSide);
        if (!violations.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "Server-side filters for %s have no client-side equivalent: %s", resourceType, violations));
        }
        log.debug("Handler tables for {} are consistent", resourceType);
    }
}

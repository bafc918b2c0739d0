package org.carball.stackops.query.handler;

import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.QueryProperty;

public interface PresetHandler {

    /**
     * True iff the preset is registered for the property on this resource type.
     */
    boolean checkSupported(QueryPresets preset, QueryProperty property);
}

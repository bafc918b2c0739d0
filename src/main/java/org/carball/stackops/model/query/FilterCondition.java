package org.carball.stackops.model.query;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.stackops.model.preset.PresetKind;
import org.carball.stackops.model.preset.QueryPresets;
import org.carball.stackops.model.property.AuxiliaryData;
import org.carball.stackops.model.property.ResourceProperty;

import java.util.Map;
import java.util.function.Predicate;

/**
 * One validated filter attached to a query: property, preset, arguments and the
 * predicate compiled from them. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class FilterCondition<R> {
    ResourceProperty<R> property;
    QueryPresets preset;
    @Singular
    Map<String, Object> arguments;
    Predicate<Object> predicate;

    /**
     * True when the condition has also been folded into the native listing filters.
     */
    boolean serverSide;

    public PresetKind getKind() {
        return preset.getKind();
    }

    public boolean test(R resource, AuxiliaryData auxiliaryData) {
        return predicate.test(property.extract(resource, auxiliaryData));
    }

    public String describe() {
        return String.format("%s %s %s", property.getPropertyName(), preset.qualifiedName(), arguments);
    }
}

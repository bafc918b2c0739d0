package org.carball.stackops.model.property;

import org.carball.stackops.exception.UnknownPropertyException;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class Properties {

    private Properties() {
    }

    /**
     * Resolves a property constant by canonical name, alias or constant name.
     */
    public static <P extends Enum<P> & QueryProperty> P fromString(Class<P> propertyType, String name,
                                                                   String resourceType) {
        for (P property : propertyType.getEnumConstants()) {
            if (property.matchesName(name) || property.name().equalsIgnoreCase(name)) {
                return property;
            }
        }
        throw new UnknownPropertyException(name, resourceType);
    }

    public static <P extends Enum<P> & QueryProperty> List<String> names(Class<P> propertyType) {
        return Arrays.stream(propertyType.getEnumConstants())
                .map(QueryProperty::getPropertyName)
                .collect(Collectors.toList());
    }
}

package org.carball.stackops.model.property;

import java.util.List;

/**
 * A named, extractable attribute of a resource type.
 */
public interface QueryProperty {

    /**
     * Canonical name, used as the column name of result records.
     */
    String getPropertyName();

    PropertyKind getKind();

    /**
     * Alternative names accepted when the property is given as text.
     */
    List<String> getAliases();

    /**
     * True when extraction needs an auxiliary lookup (project or user by id).
     */
    boolean isDerived();

    default boolean matchesName(String text) {
        if (text == null) {
            return false;
        }
        String normalised = text.trim().replace('-', '_');
        return getPropertyName().equalsIgnoreCase(normalised)
                || getAliases().stream().anyMatch(alias -> alias.equalsIgnoreCase(normalised));
    }
}

package org.carball.stackops.model.preset;

import org.carball.stackops.model.property.PropertyKind;

public enum PresetKind {
    GENERIC("generic"),
    INTEGER("integer"),
    STRING("string"),
    DATETIME("datetime");

    private final String displayName;

    PresetKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Generic presets (equality and set membership) apply to any property. Every
     * other kind only applies to properties declaring the matching kind.
     */
    public boolean accepts(PropertyKind propertyKind) {
        switch (this) {
            case GENERIC:
                return true;
            case INTEGER:
                return propertyKind == PropertyKind.INTEGER;
            case STRING:
                return propertyKind == PropertyKind.STRING;
            case DATETIME:
                return propertyKind == PropertyKind.DATETIME;
            default:
                return false;
        }
    }

    public static PresetKind fromName(String name) {
        for (PresetKind kind : values()) {
            if (kind.displayName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown preset kind: " + name);
    }
}

package org.carball.stackops.model.preset;

public enum QueryPresetsGeneric implements QueryPresets {
    EQUAL_TO,
    NOT_EQUAL_TO,
    ANY_IN,
    NOT_ANY_IN;

    @Override
    public PresetKind getKind() {
        return PresetKind.GENERIC;
    }
}

package org.carball.stackops.model.preset;

public enum QueryPresetsInteger implements QueryPresets {
    LESS_THAN,
    GREATER_THAN,
    LESS_OR_EQUAL,
    GREATER_OR_EQUAL;

    @Override
    public PresetKind getKind() {
        return PresetKind.INTEGER;
    }
}

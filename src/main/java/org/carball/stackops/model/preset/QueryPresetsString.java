package org.carball.stackops.model.preset;

public enum QueryPresetsString implements QueryPresets {
    MATCHES_REGEX,
    ANY_IN,
    NOT_ANY_IN;

    @Override
    public PresetKind getKind() {
        return PresetKind.STRING;
    }
}

package org.carball.stackops.model.preset;

/**
 * Relative-to-now comparisons on timestamp properties. "Older" means the
 * timestamp lies further in the past than the threshold.
 */
public enum QueryPresetsDateTime implements QueryPresets {
    OLDER_THAN,
    YOUNGER_THAN,
    OLDER_THAN_OR_EQUAL,
    YOUNGER_THAN_OR_EQUAL;

    @Override
    public PresetKind getKind() {
        return PresetKind.DATETIME;
    }
}

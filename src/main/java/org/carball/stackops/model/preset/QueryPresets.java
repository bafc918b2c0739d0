package org.carball.stackops.model.preset;

import org.carball.stackops.exception.UnsupportedPresetException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Common view over the four closed preset enumerations. A preset belongs to exactly one kind.
 */
public interface QueryPresets {

    String name();

    PresetKind getKind();

    /**
     * Lower-case name qualified by its kind, e.g. {@code string.matches_regex}.
     */
    default String qualifiedName() {
        return getKind().getDisplayName() + "." + name().toLowerCase();
    }

    static List<QueryPresets> all() {
        return Stream.of(QueryPresetsGeneric.values(), QueryPresetsInteger.values(),
                        QueryPresetsString.values(), QueryPresetsDateTime.values())
                .flatMap(Arrays::stream)
                .collect(Collectors.toList());
    }

    /**
     * Resolves a preset from text. Accepts a qualified name ({@code datetime.older_than})
     * or a bare one ({@code older_than}); a bare name that exists in several kinds
     * resolves to the generic preset.
     */
    static QueryPresets fromString(String text) {
        if (text == null || text.isBlank()) {
            throw new UnsupportedPresetException("Preset name must not be empty");
        }
        String normalised = text.trim().toUpperCase().replace('-', '_');
        PresetKind kind = null;
        int dot = normalised.indexOf('.');
        if (dot > 0) {
            try {
                kind = PresetKind.fromName(normalised.substring(0, dot));
            } catch (IllegalArgumentException e) {
                throw new UnsupportedPresetException("Unknown preset: " + text);
            }
            normalised = normalised.substring(dot + 1);
        }

        List<QueryPresets> matches = new ArrayList<>();
        for (QueryPresets preset : all()) {
            if (preset.name().equals(normalised) && (kind == null || preset.getKind() == kind)) {
                matches.add(preset);
            }
        }
        if (matches.isEmpty()) {
            throw new UnsupportedPresetException("Unknown preset: " + text);
        }
        return matches.stream()
                .filter(p -> p.getKind() == PresetKind.GENERIC)
                .findFirst()
                .orElse(matches.get(0));
    }
}

package org.carball.stackops.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputFormat {
    TABLE("table"),
    JSON("json");

    private final String displayName;

    OutputFormat(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static OutputFormat fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.displayName.equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name + ". Use 'table' or 'json'");
    }
}

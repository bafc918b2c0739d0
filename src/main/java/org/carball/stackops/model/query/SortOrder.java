package org.carball.stackops.model.query;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromName(String name) {
        if (name == null || name.isBlank()) {
            return ASC;
        }
        try {
            return SortOrder.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid sort order: " + name + ". Use: asc or desc");
        }
    }
}

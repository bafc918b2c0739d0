package org.carball.stackops.model.resource;

public enum ResourceType {
    SERVER("server", "servers"),
    FLOATING_IP("floating_ip", "floating_ips"),
    LOAD_BALANCER("load_balancer", "load_balancers"),
    VOLUME_SNAPSHOT("volume_snapshot", "volume_snapshots"),
    PROJECT("project", "projects"),
    USER("user", "users");

    private final String displayName;
    private final String collectionName;

    ResourceType(String displayName, String collectionName) {
        this.displayName = displayName;
        this.collectionName = collectionName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Key of the resource array in an exported cloud snapshot.
     */
    public String getCollectionName() {
        return collectionName;
    }

    /**
     * Finds a resource type by display name, collection name or constant name (case-insensitive).
     */
    public static ResourceType fromName(String name) {
        String normalised = name == null ? "" : name.trim().replace('-', '_');
        for (ResourceType type : values()) {
            if (type.displayName.equalsIgnoreCase(normalised)
                    || type.collectionName.equalsIgnoreCase(normalised)
                    || type.name().equalsIgnoreCase(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + name);
    }
}

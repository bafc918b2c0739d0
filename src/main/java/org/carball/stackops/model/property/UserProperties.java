package org.carball.stackops.model.property;

import org.carball.stackops.model.resource.User;

import java.util.List;

public enum UserProperties implements ResourceProperty<User> {
    USER_ID("id", PropertyKind.STRING, PropertyExtractor.direct(User::getId), "user_id"),
    USER_NAME("name", PropertyKind.STRING, PropertyExtractor.direct(User::getName), "user_name"),
    USER_EMAIL("email", PropertyKind.STRING, PropertyExtractor.direct(User::getEmail), "user_email"),
    USER_DESCRIPTION("description", PropertyKind.STRING, PropertyExtractor.direct(User::getDescription)),
    USER_DOMAIN_ID("domain_id", PropertyKind.STRING, PropertyExtractor.direct(User::getDomainId)),
    USER_IS_ENABLED("enabled", PropertyKind.BOOLEAN, PropertyExtractor.direct(User::getEnabled), "is_enabled");

    private final String propertyName;
    private final PropertyKind kind;
    private final PropertyExtractor<User> extractor;
    private final List<String> aliases;

    UserProperties(String propertyName, PropertyKind kind, PropertyExtractor<User> extractor, String... aliases) {
        this.propertyName = propertyName;
        this.kind = kind;
        this.extractor = extractor;
        this.aliases = List.of(aliases);
    }

    @Override
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public PropertyKind getKind() {
        return kind;
    }

    @Override
    public List<String> getAliases() {
        return aliases;
    }

    @Override
    public boolean isDerived() {
        return false;
    }

    @Override
    public Object extract(User resource, AuxiliaryData auxiliaryData) {
        return extractor.extract(resource, auxiliaryData);
    }

    public static UserProperties fromString(String name) {
        return Properties.fromString(UserProperties.class, name, "user");
    }
}

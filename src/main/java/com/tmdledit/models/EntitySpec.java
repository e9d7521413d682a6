package com.tmdledit.models;

/**
 * What to add: the entity kind and its initial properties, name included.
 */
public class EntitySpec {

    private final EntityKind kind;
    private final PropertyChanges properties;

    public EntitySpec(EntityKind kind, PropertyChanges properties) {
        this.kind = kind;
        this.properties = properties == null ? new PropertyChanges() : properties;
    }

    public static EntitySpec measure(String name, String expression) {
        return new EntitySpec(EntityKind.MEASURE, new PropertyChanges().name(name).expression(expression));
    }

    public static EntitySpec column(String name, DataType dataType) {
        return new EntitySpec(EntityKind.COLUMN, new PropertyChanges().name(name).dataType(dataType));
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return properties.getString(PropertyKey.NAME);
    }

    public PropertyChanges getProperties() {
        return properties;
    }
}

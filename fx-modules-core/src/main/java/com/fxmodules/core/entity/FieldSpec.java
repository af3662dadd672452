package com.fxmodules.core.entity;

import com.fxmodules.core.util.OrderedMaps;

import java.util.Map;
import java.util.Objects;

/**
 * One entity field: name, properties and type.
 *
 * @param name field name, also the column name
 * @param properties field properties ({@code primary-key?}, {@code optional}, relationship markers...)
 * @param type field type
 */
public record FieldSpec(String name, Map<String, Object> properties, FieldType type) {

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        properties = OrderedMaps.copyOf(properties);
    }

    public boolean flag(String property) {
        return Boolean.TRUE.equals(properties.get(property));
    }

    public boolean isPrimaryKey() {
        return flag(FieldProperties.PRIMARY_KEY);
    }

    public boolean isIdentity() {
        return flag(FieldProperties.IDENTITY);
    }

    public boolean isForeignKey() {
        return flag(FieldProperties.FOREIGN_KEY);
    }

    public boolean isOptional() {
        return flag(FieldProperties.OPTIONAL);
    }

    /**
     * True if the field carries a {@code one-to-many?} or {@code many-to-many?} marker.
     *
     * @return whether this is an optional relation (excluded from columns)
     */
    public boolean isOptionalRelation() {
        return FieldProperties.OPTIONAL_RELATIONS.stream().anyMatch(this::flag);
    }

    public FieldSpec withType(FieldType newType) {
        return new FieldSpec(name, properties, newType);
    }

    public FieldSpec withProperties(Map<String, Object> newProperties) {
        return new FieldSpec(name, newProperties, type);
    }
}

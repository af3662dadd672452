package com.fxmodules.core.entity;

import java.util.Objects;
import java.util.Optional;

/**
 * Reference schema derived from an entity's primary key.
 *
 * <p>Accepts either the raw key value or a map carrying the key, i.e.
 * {@code [:or keyType [:map [key keyType]]]}.
 *
 * @param entity entity the schema references
 * @param primaryKey name of the primary key field
 * @param keyType type of the primary key field
 */
public record EntityRefSchema(EntityType entity, String primaryKey, FieldType keyType) {

    public EntityRefSchema {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(primaryKey, "primaryKey must not be null");
        Objects.requireNonNull(keyType, "keyType must not be null");
    }

    /**
     * Derives the reference schema of a spec from its first {@code primary-key?} field.
     *
     * @param entity entity type the spec belongs to
     * @param spec canonical spec
     * @return reference schema, or empty if the spec declares no primary key
     */
    public static Optional<EntityRefSchema> derive(EntityType entity, EntitySpec spec) {
        return spec.primaryKey()
            .map(field -> new EntityRefSchema(entity, field.name(), field.type()));
    }
}

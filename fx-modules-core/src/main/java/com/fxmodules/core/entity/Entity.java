package com.fxmodules.core.entity;

import com.fxmodules.core.error.Diagnostics;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime handle of a registered entity type.
 *
 * <p>All queries go to the registry the handle is bound to, so a handle created before a
 * re-registration sees the newer schema.
 *
 * @param type entity type
 * @param registry registry holding the schema
 */
public record Entity(EntityType type, EntityRegistry registry) {

    public Entity {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
    }

    public boolean validate(Object data) {
        return registry.validate(this, data);
    }

    public Diagnostics explain(Object data) {
        return registry.explain(this, data);
    }

    public List<FieldSpec> fields() {
        return registry.fields(this);
    }

    public List<String> columns() {
        return registry.columns(this);
    }

    public List<Object> values(Map<String, ?> data) {
        return registry.values(this, data);
    }

    public Optional<FieldSpec> identityField() {
        return registry.identityField(this);
    }

    public Object property(String key) {
        return registry.property(this, key);
    }

    public boolean dependsOn(Entity dependency) {
        return registry.dependsOn(this, dependency);
    }

    @Override
    public String toString() {
        return "Entity[" + type + "]";
    }
}

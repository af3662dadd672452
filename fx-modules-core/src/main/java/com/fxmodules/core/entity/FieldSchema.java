package com.fxmodules.core.entity;

import com.fxmodules.core.util.OrderedMaps;

import java.util.Map;
import java.util.Objects;

/**
 * Simplified view of a field type for storage adapters.
 *
 * @param type type label, e.g. {@code uuid?}, {@code string}, {@code entity-ref}
 * @param properties type properties, e.g. {@code {max=250}} or {@code {entity=app/user, entity-ref=app/user-ref}}
 */
public record FieldSchema(String type, Map<String, Object> properties) {

    public FieldSchema {
        Objects.requireNonNull(type, "type must not be null");
        properties = OrderedMaps.copyOf(properties);
    }

    static FieldSchema of(FieldType fieldType) {
        if (fieldType instanceof FieldType.ParamPrimitive param) {
            return new FieldSchema(param.label(), param.properties());
        }
        if (fieldType instanceof FieldType.RefType ref) {
            return new FieldSchema(ref.label(), Map.of("entity", ref.entity(), "entity-ref", ref.entityRef()));
        }
        if (fieldType instanceof FieldType.EntityRef ref) {
            return of(FieldType.RefType.of(ref.target()));
        }
        return new FieldSchema(fieldType.label(), Map.of());
    }
}

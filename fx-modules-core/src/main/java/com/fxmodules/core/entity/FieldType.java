package com.fxmodules.core.entity;

import com.fxmodules.core.entity.type.PrimitiveType;
import com.fxmodules.core.util.OrderedMaps;

import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Closed set of field type variants.
 *
 * <p>{@link EntityRef} only appears in freshly parsed specs; normalization rewrites it to a
 * {@link RefType}, which is resolved against the registry when data is validated.
 */
public sealed interface FieldType
    permits FieldType.Primitive, FieldType.ParamPrimitive, FieldType.Validator,
            FieldType.EntityRef, FieldType.RefType {

    /**
     * Short type label used by introspection, e.g. {@code uuid?}, {@code string},
     * {@code validator}, {@code entity-ref}.
     *
     * @return type label
     */
    String label();

    /**
     * Primitive keyword type, e.g. {@code uuid?}.
     *
     * @param keyword keyword as declared
     * @param type resolved catalog entry
     */
    record Primitive(String keyword, PrimitiveType type) implements FieldType {
        public Primitive {
            Objects.requireNonNull(keyword, "keyword must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String label() {
            return keyword;
        }
    }

    /**
     * Parametrized primitive, e.g. {@code [string, {max: 250}]}.
     *
     * @param keyword keyword as declared
     * @param type resolved catalog entry
     * @param properties type parameters such as {@code min} and {@code max}
     */
    record ParamPrimitive(String keyword, PrimitiveType type, Map<String, Object> properties) implements FieldType {
        public ParamPrimitive {
            Objects.requireNonNull(keyword, "keyword must not be null");
            Objects.requireNonNull(type, "type must not be null");
            properties = OrderedMaps.copyOf(properties);
        }

        @Override
        public String label() {
            return keyword;
        }
    }

    /**
     * Caller-supplied validation predicate.
     *
     * @param predicate predicate values must satisfy
     */
    record Validator(Predicate<Object> predicate) implements FieldType {
        public Validator {
            Objects.requireNonNull(predicate, "predicate must not be null");
        }

        @Override
        public String label() {
            return "validator";
        }
    }

    /**
     * Unresolved reference to another entity, as written in the raw spec.
     *
     * @param target referenced entity type
     */
    record EntityRef(EntityType target) implements FieldType {
        public EntityRef {
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public String label() {
            return target.toString();
        }
    }

    /**
     * Canonical reference node pointing at an entity and its reference schema.
     *
     * @param entity referenced entity type
     * @param entityRef reference schema identifier of the referenced entity
     */
    record RefType(EntityType entity, EntityType entityRef) implements FieldType {
        public RefType {
            Objects.requireNonNull(entity, "entity must not be null");
            Objects.requireNonNull(entityRef, "entityRef must not be null");
        }

        public static RefType of(EntityType entity) {
            return new RefType(entity, entity.refType());
        }

        @Override
        public String label() {
            return "entity-ref";
        }
    }
}

package com.fxmodules.core.entity;

import com.fxmodules.core.error.Diagnostics;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Validates data against a canonical entity spec.
 *
 * <p>Reference fields are resolved through {@code refSchemas} at validation time, so the
 * lookup always sees the registry's current snapshot.
 */
final class SchemaValidator {

    static final String MISSING_KEY = "missing required key";
    static final String NOT_A_MAP = "should be a map";
    static final String INVALID_VALUE = "invalid value";

    private final Function<FieldType.RefType, EntityRefSchema> refSchemas;

    SchemaValidator(Function<FieldType.RefType, EntityRefSchema> refSchemas) {
        this.refSchemas = refSchemas;
    }

    Diagnostics explain(EntitySpec spec, Object data) {
        Diagnostics diagnostics = new Diagnostics();
        if (!(data instanceof Map<?, ?> values)) {
            return diagnostics.add("value", NOT_A_MAP);
        }

        for (FieldSpec field : spec.fields()) {
            Object value = values.get(field.name());
            if (value == null) {
                if (!field.isOptional()) {
                    diagnostics.add(field.name(), MISSING_KEY);
                }
                continue;
            }
            check(field, value).ifPresent(message -> diagnostics.add(field.name(), message));
        }
        return diagnostics;
    }

    private Optional<String> check(FieldSpec field, Object value) {
        if (field.isOptionalRelation() && value instanceof Collection<?> items) {
            for (Object item : items) {
                Optional<String> problem = check(field.type(), item);
                if (problem.isPresent()) {
                    return problem;
                }
            }
            return Optional.empty();
        }
        return check(field.type(), value);
    }

    Optional<String> check(FieldType type, Object value) {
        if (type instanceof FieldType.Primitive primitive) {
            return primitive.type().accepts(value) ? Optional.empty() : Optional.of(primitive.type().message());
        }
        if (type instanceof FieldType.ParamPrimitive param) {
            if (!param.type().accepts(value)) {
                return Optional.of(param.type().message());
            }
            return param.type().checkBounds(value, param.properties());
        }
        if (type instanceof FieldType.Validator validator) {
            return test(validator, value) ? Optional.empty() : Optional.of(INVALID_VALUE);
        }
        if (type instanceof FieldType.EntityRef ref) {
            return check(FieldType.RefType.of(ref.target()), value);
        }
        return checkRef((FieldType.RefType) type, value);
    }

    private Optional<String> checkRef(FieldType.RefType ref, Object value) {
        EntityRefSchema schema = refSchemas.apply(ref);
        if (check(schema.keyType(), value).isEmpty()) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> embedded) {
            Object key = embedded.get(schema.primaryKey());
            if (key == null) {
                return Optional.of("should contain key " + schema.primaryKey());
            }
            return check(schema.keyType(), key);
        }
        return Optional.of("should be a " + ref.entity() + " key or a map with key " + schema.primaryKey());
    }

    private static boolean test(FieldType.Validator validator, Object value) {
        try {
            return validator.predicate().test(value);
        } catch (ClassCastException e) {
            // predicates written for a narrower type reject everything else
            return false;
        }
    }
}

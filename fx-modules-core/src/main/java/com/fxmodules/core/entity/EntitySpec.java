package com.fxmodules.core.entity;

import com.fxmodules.core.util.OrderedMaps;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entity schema: kind keyword, entity-level properties and fields in declaration order.
 *
 * <p>Produced by {@link EntitySpecParser} (raw form, references still
 * {@link FieldType.EntityRef}) and by {@link EntitySpecNormalizer} (canonical form).
 *
 * @param kind first element of the DSL vector, conventionally {@code spec}
 * @param properties entity-level properties, e.g. {@code table}
 * @param fields fields in declaration order
 */
public record EntitySpec(String kind, Map<String, Object> properties, List<FieldSpec> fields) {

    public EntitySpec {
        Objects.requireNonNull(kind, "kind must not be null");
        properties = OrderedMaps.copyOf(properties);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }

    /**
     * First field tagged {@code primary-key?}, in declaration order.
     *
     * @return primary key field, if any
     */
    public Optional<FieldSpec> primaryKey() {
        return fields.stream().filter(FieldSpec::isPrimaryKey).findFirst();
    }

    public EntitySpec withFields(List<FieldSpec> newFields) {
        return new EntitySpec(kind, properties, newFields);
    }
}

package com.fxmodules.core.entity;

import com.fxmodules.core.error.Diagnostics;
import com.fxmodules.core.util.OrderedMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of entity schemas and their derived reference schemas.
 *
 * <p>State is a single immutable {@link Snapshot} swapped atomically on every
 * registration, so readers always see a complete registry. Registration happens while
 * the system is being declared; reads happen for the rest of the process lifetime.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EntityRegistry registry = new EntityRegistry();
 * Entity client = registry.register(EntityType.parse("app.client/client"),
 *     EntitySpecNormalizer.prepare(rawSpec).spec());
 *
 * registry.validate(client, Map.of("id", UUID.randomUUID(), "name", "Jack"));
 * List<String> columns = registry.columns(client);
 * }</pre>
 */
public final class EntityRegistry {

    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final SchemaValidator validator = new SchemaValidator(this::resolveRef);

    /**
     * Immutable registry state.
     *
     * @param entities entity schemas by entity type
     * @param refSchemas reference schemas by reference type ({@code ns/name-ref})
     */
    record Snapshot(Map<EntityType, EntitySpec> entities, Map<EntityType, EntityRefSchema> refSchemas) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        Snapshot with(EntityType type, EntitySpec spec, Optional<EntityRefSchema> refSchema) {
            Map<EntityType, EntityRefSchema> refs = refSchema
                .map(schema -> OrderedMaps.with(refSchemas, type.refType(), schema))
                .orElseGet(() -> withoutRef(type.refType()));
            return new Snapshot(OrderedMaps.with(entities, type, spec), refs);
        }

        private Map<EntityType, EntityRefSchema> withoutRef(EntityType refType) {
            if (!refSchemas.containsKey(refType)) {
                return refSchemas;
            }
            Map<EntityType, EntityRefSchema> copy = new LinkedHashMap<>(refSchemas);
            copy.remove(refType);
            return Collections.unmodifiableMap(copy);
        }
    }

    // ==================== Registration ====================

    /**
     * Registers an entity schema and its reference schema. The last registration of a type wins.
     *
     * <p>Specs that still contain raw references are normalized first.
     *
     * @param type entity type
     * @param spec canonical spec
     * @return entity handle bound to this registry
     */
    public Entity register(EntityType type, EntitySpec spec) {
        Objects.requireNonNull(type, "type must not be null");
        EntitySpec canonical = EntitySpecNormalizer.normalize(Objects.requireNonNull(spec, "spec must not be null")).spec();
        Optional<EntityRefSchema> refSchema = EntityRefSchema.derive(type, canonical);

        if (refSchema.isEmpty()) {
            log.warn("Entity {} declares no primary-key? field; it cannot be referenced", type);
        } else if (canonical.fields().stream().filter(FieldSpec::isPrimaryKey).count() > 1) {
            log.warn("Entity {} declares several primary-key? fields; references use {}", type, refSchema.get().primaryKey());
        }

        snapshot.updateAndGet(current -> current.with(type, canonical, refSchema));
        log.debug("Registered entity {} with {} fields", type, canonical.fields().size());
        return new Entity(type, this);
    }

    public boolean isRegistered(EntityType type) {
        return snapshot.get().entities().containsKey(type);
    }

    public Set<EntityType> entityTypes() {
        return snapshot.get().entities().keySet();
    }

    public Optional<EntitySpec> lookup(EntityType type) {
        return Optional.ofNullable(snapshot.get().entities().get(type));
    }

    /**
     * Returns the registered schema of a type.
     *
     * @param type entity type
     * @return canonical spec
     * @throws UnknownEntityException if the type is not registered
     */
    public EntitySpec schema(EntityType type) {
        return lookup(type).orElseThrow(() -> new UnknownEntityException(type));
    }

    /**
     * Returns the reference schema derived for an entity type.
     *
     * @param type entity type (not the {@code -ref} type)
     * @return reference schema, empty if unregistered or without primary key
     */
    public Optional<EntityRefSchema> refSchema(EntityType type) {
        return Optional.ofNullable(snapshot.get().refSchemas().get(type.refType()));
    }

    /**
     * Checks a value against the reference schema of an entity: a raw key or a map holding the key.
     *
     * @param type referenced entity type
     * @param value candidate reference
     * @return true if the value is a valid reference
     * @throws UnknownEntityException if the entity has no reference schema
     */
    public boolean isValidRef(EntityType type, Object value) {
        return validator.check(FieldType.RefType.of(type), value).isEmpty();
    }

    // ==================== Validation ====================

    /**
     * Validates data against an entity schema.
     *
     * @param entity entity handle
     * @param data candidate record, normally a map
     * @return always true; failures raise
     * @throws DataValidationException with per-field diagnostics if the data is invalid
     * @throws UnknownEntityException if the entity, or an entity it references, is not registered
     */
    public boolean validate(Entity entity, Object data) {
        Diagnostics diagnostics = explain(entity, data);
        if (!diagnostics.isEmpty()) {
            throw new DataValidationException(entity.type(), diagnostics);
        }
        return true;
    }

    /**
     * Validates without raising.
     *
     * @param entity entity handle
     * @param data candidate record
     * @return per-field diagnostics, empty when the data is valid
     */
    public Diagnostics explain(Entity entity, Object data) {
        return validator.explain(schema(entity.type()), data);
    }

    private EntityRefSchema resolveRef(FieldType.RefType ref) {
        EntityRefSchema schema = snapshot.get().refSchemas().get(ref.entityRef());
        if (schema != null) {
            return schema;
        }
        if (isRegistered(ref.entity())) {
            throw new UnknownEntityException(ref.entity(), "Entity " + ref.entity() + " has no primary key to reference");
        }
        throw new UnknownEntityException(ref.entity());
    }

    // ==================== Introspection ====================

    /**
     * Persisted fields of an entity in declaration order; optional relations are left out.
     *
     * @param entity entity handle
     * @return field specs
     */
    public List<FieldSpec> fields(Entity entity) {
        return schema(entity.type()).fields().stream()
            .filter(field -> !field.isOptionalRelation())
            .toList();
    }

    public List<String> columns(Entity entity) {
        return fields(entity).stream().map(FieldSpec::name).toList();
    }

    /**
     * Extracts column values in column order, e.g. {@code {id=1, name=Jack}} to {@code [1, Jack]}.
     *
     * @param entity entity handle
     * @param data record
     * @return values in column order; absent columns yield null
     */
    public List<Object> values(Entity entity, Map<String, ?> data) {
        List<Object> values = new ArrayList<>();
        for (String column : columns(entity)) {
            values.add(data.get(column));
        }
        return Collections.unmodifiableList(values);
    }

    public Optional<FieldSpec> identityField(Entity entity) {
        return schema(entity.type()).fields().stream()
            .filter(FieldSpec::isIdentity)
            .findFirst();
    }

    public Object property(Entity entity, String key) {
        return schema(entity.type()).properties().get(key);
    }

    /**
     * Checks whether {@code target} holds a foreign key to {@code dependency}.
     *
     * @param target entity that may depend
     * @param dependency entity that may be depended on
     * @return true if a required foreign-key field of target points at dependency
     */
    public boolean dependsOn(Entity target, Entity dependency) {
        return fields(target).stream()
            .filter(FieldSpec::isForeignKey)
            .map(FieldSpec::type)
            .anyMatch(type -> type instanceof FieldType.RefType ref && ref.entity().equals(dependency.type()));
    }

    /**
     * True if the field references an entity that is currently registered.
     *
     * @param field field spec
     * @return whether the field is a resolvable reference
     */
    public boolean isRef(FieldSpec field) {
        return field.type() instanceof FieldType.RefType ref && isRegistered(ref.entity());
    }

    public FieldSchema fieldSchema(FieldSpec field) {
        return FieldSchema.of(field.type());
    }

    /**
     * Reads an entity-level property of the entity a reference field points at,
     * e.g. the referenced table name.
     *
     * @param field reference field
     * @param key property key
     * @return property value, or null if the field is not a registered reference
     */
    public Object refFieldProperty(FieldSpec field, String key) {
        if (!(field.type() instanceof FieldType.RefType ref)) {
            return null;
        }
        return lookup(ref.entity())
            .map(spec -> spec.properties().get(key))
            .orElse(null);
    }
}

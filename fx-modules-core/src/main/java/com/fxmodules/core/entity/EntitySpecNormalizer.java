package com.fxmodules.core.entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites parsed entity specs into canonical form.
 *
 * <ul>
 *   <li>{@link FieldType.EntityRef} fields become {@link FieldType.RefType} nodes; unless the
 *       field is a {@code one-to-many?}/{@code many-to-many?} relation they are flagged
 *       {@code foreign-key?} and their target becomes a dependency.</li>
 *   <li>{@code optional?} is renamed {@code optional}; optional relations are always optional.</li>
 * </ul>
 *
 * <p>Targets are not looked up here: a referenced entity may be declared later, or may
 * reference this one back.
 */
public final class EntitySpecNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EntitySpecNormalizer.class);

    private EntitySpecNormalizer() {
    }

    /**
     * Parses and normalizes a raw spec.
     *
     * @param raw raw spec in DSL form
     * @return canonical spec and its required dependencies
     * @throws SpecGrammarException if the raw spec violates the grammar
     */
    public static PreparedSpec prepare(Object raw) {
        return normalize(EntitySpecParser.parse(raw));
    }

    /**
     * Normalizes a parsed spec. Normalizing an already canonical spec returns an equal spec.
     *
     * @param spec parsed or canonical spec
     * @return canonical spec and its required dependencies
     */
    public static PreparedSpec normalize(EntitySpec spec) {
        List<FieldSpec> fields = new ArrayList<>();
        Set<EntityType> dependencies = new LinkedHashSet<>();

        for (FieldSpec field : spec.fields()) {
            boolean optionalRelation = field.isOptionalRelation();
            Map<String, Object> properties = new LinkedHashMap<>(field.properties());
            FieldType type = field.type();

            if (type instanceof FieldType.EntityRef ref) {
                type = FieldType.RefType.of(ref.target());
            }

            if (type instanceof FieldType.RefType refType && !optionalRelation) {
                properties.put(FieldProperties.FOREIGN_KEY, true);
                dependencies.add(refType.entity());
            }

            Object optionalInput = properties.remove(FieldProperties.OPTIONAL_INPUT);
            if (Boolean.TRUE.equals(optionalInput) || optionalRelation) {
                properties.put(FieldProperties.OPTIONAL, true);
            }

            fields.add(new FieldSpec(field.name(), properties, type));
        }

        log.debug("Normalized entity spec with {} fields, dependencies {}", fields.size(), dependencies);
        return new PreparedSpec(spec.withFields(fields), new ArrayList<>(dependencies));
    }
}

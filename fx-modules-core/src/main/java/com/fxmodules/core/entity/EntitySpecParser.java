package com.fxmodules.core.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fxmodules.core.entity.type.PrimitiveType;
import com.fxmodules.core.error.Diagnostics;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Parses raw entity declarations written in the entity DSL.
 *
 * <p>Grammar:
 * <pre>
 * entity = [kind, properties?, field*]
 * field  = [name, properties?, type]
 * type   = validator | typeKeyword | [typeKeyword, properties] | qualifiedEntityKeyword
 * </pre>
 *
 * <p>The raw form is a {@link List} tree, written in Java or read from YAML/JSON:
 * <pre>{@code
 * List.of("spec", Map.of("table", "client"),
 *     List.of("id", Map.of("primary-key?", true), "uuid?"),
 *     List.of("name", List.of("string", Map.of("max", 250))),
 *     List.of("user", Map.of("one-to-many?", true), "app.user/user"));
 * }</pre>
 *
 * <p>Keywords are strings; a leading {@code :} is accepted and dropped. A string containing
 * {@code /} is a reference to another entity. Field names are distinct. Any violation is reported at once through
 * {@link SpecGrammarException} with one entry per offending location.
 */
public final class EntitySpecParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<List<Object>> RAW_SPEC = new TypeReference<>() {
    };

    private static final String TYPE_EXPECTATION =
        "should be a validator, a type keyword, [type keyword, properties] or a qualified entity keyword";

    private EntitySpecParser() {
    }

    /**
     * Parses a raw spec into its typed, not yet normalized, form.
     *
     * @param raw raw spec
     * @return parsed spec whose references are {@link FieldType.EntityRef}
     * @throws SpecGrammarException if the spec does not follow the grammar
     */
    public static EntitySpec parse(Object raw) {
        Diagnostics diagnostics = new Diagnostics();
        EntitySpec spec = parse(raw, diagnostics);
        if (!diagnostics.isEmpty()) {
            throw new SpecGrammarException("Invalid entity spec", diagnostics);
        }
        return spec;
    }

    /**
     * Checks a raw spec against the grammar without raising.
     *
     * @param raw raw spec
     * @return humanized grammar errors, empty if the spec is valid
     */
    public static Diagnostics explain(Object raw) {
        Diagnostics diagnostics = new Diagnostics();
        parse(raw, diagnostics);
        return diagnostics;
    }

    public static boolean isValid(Object raw) {
        return explain(raw).isEmpty();
    }

    /**
     * Reads a raw spec from a YAML document and parses it.
     *
     * @param yaml YAML sequence in DSL shape
     * @return parsed spec
     * @throws SpecGrammarException if the document is not YAML or violates the grammar
     */
    public static EntitySpec readYaml(String yaml) {
        return parse(read(YAML_MAPPER, yaml));
    }

    /**
     * Reads a raw spec from a JSON array and parses it.
     *
     * @param json JSON array in DSL shape
     * @return parsed spec
     * @throws SpecGrammarException if the document is not JSON or violates the grammar
     */
    public static EntitySpec readJson(String json) {
        return parse(read(JSON_MAPPER, json));
    }

    private static List<Object> read(ObjectMapper mapper, String document) {
        try {
            return mapper.readValue(document, RAW_SPEC);
        } catch (JsonProcessingException e) {
            throw new SpecGrammarException("Unreadable entity spec",
                new Diagnostics().add("document", e.getOriginalMessage()));
        }
    }

    private static EntitySpec parse(Object raw, Diagnostics diagnostics) {
        if (!(raw instanceof List<?> items) || items.isEmpty()) {
            diagnostics.add("entity", "should be a non-empty sequence [kind, properties?, field*]");
            return null;
        }

        Optional<String> kind = keyword(items.get(0));
        if (kind.isEmpty()) {
            diagnostics.add("entity", "should start with a keyword");
        }

        int index = 1;
        Map<String, Object> properties = Map.of();
        if (items.size() > 1 && items.get(1) instanceof Map<?, ?> map) {
            properties = properties(map, "properties", diagnostics);
            index = 2;
        }

        List<FieldSpec> fields = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = index; i < items.size(); i++) {
            String path = "fields[" + (i - index) + "]";
            FieldSpec field = parseField(items.get(i), path, diagnostics);
            if (field == null) {
                continue;
            }
            if (!names.add(field.name())) {
                diagnostics.add(path + ".name", "duplicate field name " + field.name());
                continue;
            }
            fields.add(field);
        }

        if (!diagnostics.isEmpty()) {
            return null;
        }
        return new EntitySpec(kind.get(), properties, fields);
    }

    private static FieldSpec parseField(Object raw, String path, Diagnostics diagnostics) {
        if (!(raw instanceof List<?> parts) || parts.size() < 2 || parts.size() > 3) {
            diagnostics.add(path, "should be a sequence [name, properties?, type]");
            return null;
        }

        Optional<String> name = keyword(parts.get(0)).filter(text -> !EntityType.isQualified(text));
        if (name.isEmpty()) {
            diagnostics.add(path + ".name", "should be a simple keyword");
        }

        Map<String, Object> properties = Map.of();
        if (parts.size() == 3) {
            if (parts.get(1) instanceof Map<?, ?> map) {
                properties = properties(map, path + ".properties", diagnostics);
            } else {
                diagnostics.add(path + ".properties", "should be a map");
            }
        }

        FieldType type = parseType(parts.get(parts.size() - 1), path + ".type", diagnostics);
        if (name.isEmpty() || type == null) {
            return null;
        }
        return new FieldSpec(name.get(), properties, type);
    }

    @SuppressWarnings("unchecked")
    private static FieldType parseType(Object raw, String path, Diagnostics diagnostics) {
        if (raw instanceof Predicate<?> predicate) {
            return new FieldType.Validator((Predicate<Object>) predicate);
        }

        if (raw instanceof FieldType.RefType refType) {
            return refType;
        }

        if (raw instanceof String text) {
            if (EntityType.isQualified(text)) {
                return new FieldType.EntityRef(EntityType.parse(text));
            }
            return primitive(text, path, diagnostics)
                .map(type -> (FieldType) new FieldType.Primitive(EntityType.stripColon(text), type))
                .orElse(null);
        }

        if (raw instanceof List<?> tuple && tuple.size() == 2
                && tuple.get(0) instanceof String keyword && tuple.get(1) instanceof Map<?, ?> map) {
            Map<String, Object> typeProperties = properties(map, path, diagnostics);
            Optional<PrimitiveType> type = primitive(keyword, path, diagnostics);
            if (type.isEmpty()) {
                return null;
            }
            Optional<String> problem = type.get().checkProperties(typeProperties);
            if (problem.isPresent()) {
                diagnostics.add(path, problem.get());
                return null;
            }
            return new FieldType.ParamPrimitive(EntityType.stripColon(keyword), type.get(), typeProperties);
        }

        diagnostics.add(path, TYPE_EXPECTATION);
        return null;
    }

    private static Optional<PrimitiveType> primitive(String keyword, String path, Diagnostics diagnostics) {
        Optional<PrimitiveType> type = PrimitiveType.lookup(keyword);
        if (type.isEmpty()) {
            diagnostics.add(path, "unknown type " + keyword);
        }
        return type;
    }

    private static Map<String, Object> properties(Map<?, ?> raw, String path, Diagnostics diagnostics) {
        Map<String, Object> properties = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            Optional<String> name = keyword(key);
            if (name.isPresent()) {
                properties.put(name.get(), value);
            } else {
                diagnostics.add(path, "property keys should be keywords, got " + key);
            }
        });
        return properties;
    }

    private static Optional<String> keyword(Object raw) {
        if (!(raw instanceof String text)) {
            return Optional.empty();
        }
        String stripped = EntityType.stripColon(text);
        if (stripped.isEmpty() || stripped.chars().anyMatch(Character::isWhitespace)) {
            return Optional.empty();
        }
        return Optional.of(stripped);
    }
}

package com.fxmodules.core.entity;

import com.fxmodules.core.entity.type.PrimitiveType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link EntitySpecParser}.
 */
class EntitySpecParserTest {

    @Test
    void parse_fullSpec_keepsKindPropertiesAndFieldOrder() {
        EntitySpec spec = EntitySpecParser.parse(EntityFixtures.CLIENT_SPEC);

        assertThat(spec.kind()).isEqualTo("spec");
        assertThat(spec.properties()).containsEntry("table", "client");
        assertThat(spec.fields()).extracting(FieldSpec::name).containsExactly("id", "name", "users");
    }

    @Test
    void parse_typeVariants_mapToFieldTypes() {
        EntitySpec spec = EntitySpecParser.parse(EntityFixtures.CLIENT_SPEC);

        assertThat(spec.field("id").orElseThrow().type())
            .isEqualTo(new FieldType.Primitive("uuid?", PrimitiveType.UUID_TYPE));
        assertThat(spec.field("name").orElseThrow().type())
            .isEqualTo(new FieldType.ParamPrimitive("string", PrimitiveType.STRING, Map.of("max", 250)));
        assertThat(spec.field("users").orElseThrow().type())
            .isEqualTo(new FieldType.EntityRef(EntityFixtures.USER));
    }

    @Test
    void parse_leadingColons_areStripped() {
        EntitySpec spec = EntitySpecParser.parse(EntityFixtures.USER_SPEC);

        assertThat(spec.kind()).isEqualTo("spec");
        assertThat(spec.field("id").orElseThrow().type().label()).isEqualTo("uuid?");
        assertThat(spec.field("client").orElseThrow().type())
            .isEqualTo(new FieldType.EntityRef(EntityFixtures.CLIENT));
    }

    @Test
    void parse_specWithoutProperties_hasEmptyProperties() {
        EntitySpec spec = EntitySpecParser.parse(List.of("spec", List.of("id", "int")));

        assertThat(spec.properties()).isEmpty();
        assertThat(spec.fields()).hasSize(1);
    }

    @Test
    void parse_validatorType_keepsPredicate() {
        Predicate<Object> positive = value -> ((Integer) value) > 0;

        EntitySpec spec = EntitySpecParser.parse(List.of("spec", List.of("age", positive)));

        assertThat(spec.fields().get(0).type()).isEqualTo(new FieldType.Validator(positive));
    }

    @Test
    void parse_unknownTypeKeyword_reportsFieldPath() {
        List<Object> raw = List.of("spec", List.of("id", "uuid?"), List.of("name", "strin"));

        assertThatThrownBy(() -> EntitySpecParser.parse(raw))
            .isInstanceOf(SpecGrammarException.class)
            .satisfies(e -> assertThat(((SpecGrammarException) e).getErrors())
                .containsOnlyKeys("fields[1].type")
                .containsEntry("fields[1].type", List.of("unknown type strin")));
    }

    @Test
    void parse_notASequence_reportsEntity() {
        assertThatThrownBy(() -> EntitySpecParser.parse(Map.of("id", "uuid")))
            .isInstanceOf(SpecGrammarException.class)
            .satisfies(e -> assertThat(((SpecGrammarException) e).getErrors()).containsOnlyKeys("entity"));
    }

    @Test
    void explain_severalViolations_reportsEachLocation() {
        List<Object> raw = List.of("spec",
            List.of("id", Map.of("primary-key?", true), "uuid?", "extra"),
            List.of("has space", "string"),
            List.of("size", List.of("int", Map.of("max", "ten"))),
            List.of("weird", 12));

        assertThat(EntitySpecParser.explain(raw).asMap()).containsOnlyKeys(
            "fields[0]", "fields[1].name", "fields[2].type", "fields[3].type");
        assertThat(EntitySpecParser.explain(raw).asMap().get("fields[2].type"))
            .containsExactly("property max should be a number");
    }

    @Test
    void explain_fieldPropertiesNotAMap_reportsProperties() {
        List<Object> raw = List.of("spec", List.of("id", "primary", "uuid?"));

        assertThat(EntitySpecParser.explain(raw).asMap()).containsOnlyKeys("fields[0].properties");
    }

    @Test
    void explain_duplicateFieldName_reportsSecondField() {
        List<Object> raw = List.of("spec",
            List.of("id", Map.of("primary-key?", true), "uuid?"),
            List.of("name", "string"),
            List.of(":id", "string"));

        assertThat(EntitySpecParser.isValid(raw)).isFalse();
        assertThat(EntitySpecParser.explain(raw).asMap())
            .containsExactly(Map.entry("fields[2].name", List.of("duplicate field name id")));
        assertThatThrownBy(() -> EntitySpecParser.parse(raw))
            .isInstanceOf(SpecGrammarException.class)
            .hasMessageContaining("duplicate field name id");
    }

    @Test
    void isValid_validSpec_returnsTrue() {
        assertThat(EntitySpecParser.isValid(EntityFixtures.USER_SPEC)).isTrue();
        assertThat(EntitySpecParser.isValid(List.of())).isFalse();
    }

    @Test
    void readYaml_dslDocument_parsesSpec() {
        EntitySpec spec = EntitySpecParser.readYaml("""
            - spec
            - table: client
            - [id, {"primary-key?": true}, "uuid?"]
            - [name, [string, {max: 250}]]
            - [users, {"one-to-many?": true}, app.user/user]
            """);

        assertThat(spec.properties()).containsEntry("table", "client");
        assertThat(spec.field("id").orElseThrow().isPrimaryKey()).isTrue();
        assertThat(spec.field("name").orElseThrow().type())
            .isEqualTo(new FieldType.ParamPrimitive("string", PrimitiveType.STRING, Map.of("max", 250)));
        assertThat(spec.field("users").orElseThrow().isOptionalRelation()).isTrue();
    }

    @Test
    void readJson_malformedDocument_reportsDocument() {
        assertThatThrownBy(() -> EntitySpecParser.readJson("[\"spec\", "))
            .isInstanceOf(SpecGrammarException.class)
            .satisfies(e -> assertThat(((SpecGrammarException) e).getErrors()).containsOnlyKeys("document"));
    }

    @Test
    void readJson_dslDocument_parsesSpec() {
        EntitySpec spec = EntitySpecParser.readJson("[\"spec\", [\"id\", {\"primary-key?\": true}, \"int\"]]");

        assertThat(spec.primaryKey()).map(FieldSpec::name).contains("id");
    }
}

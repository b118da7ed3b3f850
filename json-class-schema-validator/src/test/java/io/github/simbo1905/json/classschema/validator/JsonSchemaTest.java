package io.github.simbo1905.json.classschema.validator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaTest extends JsonSchemaTestBase {

    private static final String PERSON = """
        {
          "$schema": "https://json-schema.org/draft/2020-12/schema",
          "$defs": {},
          "type": "object",
          "properties": {
            "name": {"type": "string"},
            "age": {"type": "integer"}
          },
          "required": ["name", "age"],
          "additionalProperties": false
        }
        """;

    @Test
    void acceptsMatchingObject() {
        var result = validate(PERSON, """
            {"name": "John Doe", "age": 43}
            """);
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void reportsMissingRequiredProperty() {
        var result = validate(PERSON, """
            {"name": "John Doe"}
            """);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).extracting(JsonSchema.ValidationError::message)
            .containsExactly("Missing required property: age");
    }

    @Test
    void rejectsAdditionalProperties() {
        var result = validate(PERSON, """
            {"name": "John Doe", "age": 43, "email": "john@example.com"}
            """);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0).path()).isEqualTo("email");
        assertThat(result.errors().get(0).message()).isEqualTo("Additional properties not allowed");
    }

    @Test
    void integerRejectsFractionButAcceptsIntegralDecimal() {
        String schema = """
            {"type": "integer"}
            """;
        assertThat(validate(schema, "7").valid()).isTrue();
        assertThat(validate(schema, "7.0").valid()).isTrue();
        var fractional = validate(schema, "7.5");
        assertThat(fractional.valid()).isFalse();
        assertThat(fractional.errors().get(0).message()).isEqualTo("Expected integer");
        assertThat(validate(schema, "\"7\"").valid()).isFalse();
    }

    @Test
    void nestedErrorsCarryDottedPaths() {
        var result = validate("""
            {
              "type": "object",
              "properties": {
                "address": {
                  "type": "object",
                  "properties": {"zip": {"type": "string"}}
                }
              }
            }
            """, """
            {"address": {"zip": 12345}}
            """);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors().get(0).path()).isEqualTo("address.zip");
        assertThat(result.errors().get(0).toString()).isEqualTo("address.zip: Expected string");
    }

    @Test
    void typedArrayItemsAreValidated() {
        String schema = """
            {"type": "array", "items": {"type": "number"}}
            """;
        assertThat(validate(schema, "[1, 2.5, -3]").valid()).isTrue();
        var result = validate(schema, "[1, \"two\", 3]");
        assertThat(result.valid()).isFalse();
        assertThat(result.errors().get(0).path()).isEqualTo("[1]");
    }

    @Test
    void prefixItemsCheckEachPosition() {
        String schema = """
            {"type": "array", "prefixItems": [{"type": "string"}, {"type": "integer"}, {"type": "boolean"}]}
            """;
        assertThat(validate(schema, "[\"a\", 1, true]").valid()).isTrue();
        assertThat(validate(schema, "[\"a\", \"b\", true]").valid()).isFalse();
    }

    @Test
    void stringEnumMatchesOnlyListedNames() {
        String schema = """
            {"type": "string", "enum": ["MALE", "FEMALE"]}
            """;
        assertThat(validate(schema, "\"FEMALE\"").valid()).isTrue();
        var result = validate(schema, "\"OTHER\"");
        assertThat(result.valid()).isFalse();
        assertThat(result.errors().get(0).message()).isEqualTo("Not in enum");
    }

    @Test
    void enumAndConstCompareNumbersByValue() {
        assertThat(validate("""
            {"enum": [1, 2]}
            """, "1.0").valid()).isTrue();
        assertThat(validate("""
            {"const": {"a": [1, 2]}}
            """, "{\"a\": [1.0, 2]}").valid()).isTrue();
    }

    @Test
    void keywordOnlySchemasIgnoreOtherTypes() {
        String schema = """
            {"properties": {"a": {"type": "string"}}}
            """;
        assertThat(validate(schema, "42").valid()).isTrue();
        assertThat(validate(schema, "{\"a\": 1}").valid()).isFalse();
    }

    @Test
    void typeArrayBehavesLikeAnyOf() {
        String schema = """
            {"type": ["string", "null"]}
            """;
        assertThat(validate(schema, "null").valid()).isTrue();
        assertThat(validate(schema, "\"x\"").valid()).isTrue();
        assertThat(validate(schema, "1").valid()).isFalse();
    }

    @Test
    void compositionKeywords() {
        assertThat(validate("""
            {"oneOf": [{"type": "integer"}, {"type": "number"}]}
            """, "1").valid()).isFalse();
        assertThat(validate("""
            {"anyOf": [{"type": "integer"}, {"type": "string"}]}
            """, "\"s\"").valid()).isTrue();
        assertThat(validate("""
            {"not": {"type": "null"}}
            """, "null").valid()).isFalse();
        assertThat(validate("""
            {"allOf": [{"minimum": 1}, {"maximum": 3}]}
            """, "4").valid()).isFalse();
    }

    @Test
    void booleanSchemas() {
        assertThat(validate("true", "{\"anything\": 1}").valid()).isTrue();
        assertThat(validate("false", "1").valid()).isFalse();
    }

    @Test
    void invalidSchemasAreRejected() {
        assertThatThrownBy(() -> JsonSchema.compile(json("42")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonSchema.compile(json("""
            {"type": "widget"}
            """)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("widget");
        assertThatThrownBy(() -> JsonSchema.compile(json("""
            {"type": "string", "pattern": "(unclosed"}
            """)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.simbo1905.json.classschema.validator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSchemaRefLocalTest extends JsonSchemaTestBase {

    @Test
    void defsReferenceIsFollowed() {
        String schema = """
            {
              "$defs": {
                "Address": {
                  "type": "object",
                  "properties": {"city": {"type": "string"}},
                  "required": ["city"],
                  "additionalProperties": false
                }
              },
              "type": "object",
              "properties": {"home": {"$ref": "#/$defs/Address"}},
              "required": ["home"]
            }
            """;
        assertThat(validate(schema, """
            {"home": {"city": "Leeds"}}
            """).valid()).isTrue();
        var result = validate(schema, """
            {"home": {}}
            """);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors().get(0).path()).isEqualTo("home");
        assertThat(result.errors().get(0).message()).isEqualTo("Missing required property: city");
    }

    @Test
    void recursiveDefinitionValidatesNestedInstances() {
        String schema = """
            {
              "$defs": {
                "Node": {
                  "type": "object",
                  "properties": {
                    "value": {"type": "integer"},
                    "children": {"type": "array", "items": {"$ref": "#/$defs/Node"}}
                  },
                  "required": ["value", "children"],
                  "additionalProperties": false
                }
              },
              "$ref": "#/$defs/Node"
            }
            """;
        assertThat(validate(schema, """
            {"value": 1, "children": [{"value": 2, "children": []}]}
            """).valid()).isTrue();
        var result = validate(schema, """
            {"value": 1, "children": [{"value": "two", "children": []}]}
            """);
        assertThat(result.valid()).isFalse();
        assertThat(result.errors().get(0).path()).isEqualTo("children[0].value");
    }

    @Test
    void rootReferenceRecurses() {
        String schema = """
            {
              "type": "object",
              "properties": {"next": {"anyOf": [{"type": "null"}, {"$ref": "#"}]}},
              "required": ["next"]
            }
            """;
        assertThat(validate(schema, """
            {"next": {"next": null}}
            """).valid()).isTrue();
        assertThat(validate(schema, """
            {"next": {"next": 5}}
            """).valid()).isFalse();
    }

    @Test
    void escapedDefinitionNamesResolve() {
        String schema = """
            {
              "$defs": {"res://scripts/item.gd": {"type": "string"}},
              "type": "object",
              "properties": {"item": {"$ref": "#/$defs/res:~1~1scripts~1item.gd"}}
            }
            """;
        assertThat(validate(schema, """
            {"item": "sword"}
            """).valid()).isTrue();
        assertThat(validate(schema, """
            {"item": 3}
            """).valid()).isFalse();
    }

    @Test
    void anchorAndPropertyPointerRefs() {
        String schema = """
            {
              "$defs": {"Name": {"$anchor": "name", "type": "string", "minLength": 1}},
              "type": "object",
              "properties": {
                "first": {"$ref": "#name"},
                "last": {"$ref": "#/properties/first"}
              }
            }
            """;
        assertThat(validate(schema, """
            {"first": "Ada", "last": "Lovelace"}
            """).valid()).isTrue();
        assertThat(validate(schema, """
            {"first": "Ada", "last": ""}
            """).valid()).isFalse();
    }

    @Test
    void unresolvedAndRemoteRefsFailAtCompileTime() {
        assertThatThrownBy(() -> JsonSchema.compile(json("""
            {"$ref": "#/$defs/Missing"}
            """)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unresolved $ref");
        assertThatThrownBy(() -> JsonSchema.compile(json("""
            {"$ref": "https://example.com/schema.json"}
            """)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Remote $ref not supported");
    }
}

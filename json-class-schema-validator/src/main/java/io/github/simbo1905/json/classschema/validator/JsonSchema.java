/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// JSON Schema public API entry point
///
/// This interface provides the public API for compiling and validating schemas
/// while delegating implementation details to package-private classes.
/// Only documents that are self-contained are accepted: every `$ref` must point
/// inside the document being compiled.
///
/// ## Usage
/// ```java
/// // Compile schema once (thread-safe, reusable)
/// JsonSchema schema = JsonSchema.compile(mapper.readTree(schemaJson));
///
/// // Validate JSON documents
/// ValidationResult result = schema.validate(mapper.readTree(jsonDoc));
///
/// if (!result.valid()){
///     for (var error : result.errors()){
///         System.out.println(error.path() + ": " + error.message());
///     }
/// }
/// ```
public sealed interface JsonSchema
    permits ObjectSchema,
    ArraySchema,
    StringSchema,
    NumberSchema,
    BooleanSchema,
    NullSchema,
    AnySchema,
    RefSchema,
    AllOfSchema,
    AnyOfSchema,
    OneOfSchema,
    ConstSchema,
    NotSchema,
    RootRef,
    EnumSchema {

  /// Shared logger
  Logger LOG = SchemaLogging.LOG;

  // Public constants for common JSON Pointer fragments used in schemas
  String SCHEMA_DEFS_POINTER = "#/$defs/";
  String SCHEMA_PROPERTIES_SEGMENT = "/properties/";
  String SCHEMA_POINTER_PREFIX = "#/";
  String SCHEMA_POINTER_ROOT = "#";

  /// Options for schema compilation
  ///
  /// @param maxPatternLength upper bound on `pattern` and `patternProperties` regex source length
  record JsonSchemaOptions(int maxPatternLength) {
    /// Default options
    public static final JsonSchemaOptions DEFAULT = new JsonSchemaOptions(4096);

    public JsonSchemaOptions {
      if (maxPatternLength <= 0) {
        throw new IllegalArgumentException("maxPatternLength must be > 0");
      }
    }

    String summary() {
      return "maxPatternLength=" + maxPatternLength;
    }
  }

  /// Factory method to create schema from JSON Schema document
  ///
  /// @param schemaJson JSON Schema document
  /// @return Immutable JsonSchema instance
  /// @throws IllegalArgumentException if schema is invalid
  static JsonSchema compile(JsonNode schemaJson) {
    return compile(schemaJson, JsonSchemaOptions.DEFAULT);
  }

  /// Factory method to create schema from JSON Schema document with options
  ///
  /// @param schemaJson JSON Schema document
  /// @param jsonSchemaOptions compilation options
  /// @return Immutable JsonSchema instance
  /// @throws IllegalArgumentException if schema is invalid
  static JsonSchema compile(JsonNode schemaJson, JsonSchemaOptions jsonSchemaOptions) {
    Objects.requireNonNull(schemaJson, "schemaJson");
    Objects.requireNonNull(jsonSchemaOptions, "jsonSchemaOptions");
    LOG.fine(() -> "compile: start options=" + jsonSchemaOptions.summary() + ", schema type: " + schemaJson.getNodeType());
    JsonSchema result = SchemaCompiler.compile(schemaJson, jsonSchemaOptions);
    LOG.fine(() -> "compile: done result type: " + result.getClass().getSimpleName());
    return result;
  }

  /// Validates JSON document against this schema
  ///
  /// @param json JSON value to validate
  /// @return ValidationResult with success/failure information
  default ValidationResult validate(JsonNode json) {
    Objects.requireNonNull(json, "json");
    LOG.fine(() -> "validate: start schema=" + getClass().getSimpleName());
    List<ValidationError> errors = new ArrayList<>();
    Deque<ValidationFrame> stack = new ArrayDeque<>();
    Set<ValidationKey> visited = new HashSet<>();
    stack.push(new ValidationFrame("", this, json));

    int iterationCount = 0;
    int maxDepthObserved = 0;
    final int WARNING_THRESHOLD = 10_000;

    while (!stack.isEmpty()) {
      iterationCount++;
      if (stack.size() > maxDepthObserved) maxDepthObserved = stack.size();
      if (iterationCount % WARNING_THRESHOLD == 0) {
        final int processed = iterationCount;
        final int pending = stack.size();
        final int maxDepth = maxDepthObserved;
        LOG.fine(() -> "PERFORMANCE WARNING: Validation stack processed=" + processed + " pending=" + pending + " maxDepth=" + maxDepth);
      }

      ValidationFrame frame = stack.pop();
      ValidationKey key = new ValidationKey(frame.schema(), frame.json(), frame.path());
      if (!visited.add(key)) {
        LOG.finest(() -> "SKIP " + frame.path() + "   schema=" + frame.schema().getClass().getSimpleName());
        continue;
      }
      LOG.finest(() -> "POP " + frame.path() + "   schema=" + frame.schema().getClass().getSimpleName());
      ValidationResult result = frame.schema().validateAt(frame.path(), frame.json(), stack);
      if (!result.valid()) {
        errors.addAll(result.errors());
      }
    }

    final int errorCount = errors.size();
    LOG.fine(() -> "validate: done errors=" + errorCount);
    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }

  /// Internal validation method used by stack-based traversal
  ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack);

  /// Validation result types
  record ValidationResult(boolean valid, List<ValidationError> errors) {
    public static ValidationResult success() {
      return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<ValidationError> errors) {
      return new ValidationResult(false, List.copyOf(errors));
    }
  }

  record ValidationError(String path, String message) {
    @Override
    public String toString() {
      return path.isEmpty() ? message : path + ": " + message;
    }
  }

  /// Validation frame for stack-based processing
  record ValidationFrame(String path, JsonSchema schema, JsonNode json) {
  }

  /// Internal key used to detect and break validation cycles
  record ValidationKey(JsonSchema schema, JsonNode json, String path) {

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof ValidationKey other)) {
        return false;
      }
      return this.schema == other.schema &&
          this.json == other.json &&
          Objects.equals(this.path, other.path);
    }

    @Override
    public int hashCode() {
      int result = System.identityHashCode(schema);
      result = 31 * result + System.identityHashCode(json);
      result = 31 * result + (path != null ? path.hashCode() : 0);
      return result;
    }
  }

  /// Local `$ref` pointer or anchor within the compiled document
  record RefToken(String pointer) {
    public RefToken {
      Objects.requireNonNull(pointer, "pointer");
    }
  }

  /// Resolver context for validation-time $ref resolution
  record ResolverContext(Map<String, JsonSchema> localPointerIndex, Supplier<JsonSchema> rootSchema) {
    /// Resolve a RefToken to the target schema
    JsonSchema resolve(RefToken token) {
      String pointer = token.pointer();
      LOG.finest(() -> "ResolverContext.resolve: " + pointer + ", localPointerIndex.size=" + localPointerIndex.size());
      if (pointer.equals(SCHEMA_POINTER_ROOT) || pointer.isEmpty()) {
        return rootSchema.get();
      }
      JsonSchema target = localPointerIndex.get(pointer);
      if (target == null) {
        throw new IllegalArgumentException("Unresolved $ref: " + pointer);
      }
      return target;
    }
  }
}

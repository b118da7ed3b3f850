package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Boolean schema - validates boolean values
///
/// The literal boolean schemas `true` and `false` compile to [AnySchema] and
/// [NotSchema#NOTHING] instead.
public record BooleanSchema() implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isBoolean()) {
      return ValidationResult.failure(List.of(
          new ValidationError(path, "Expected boolean")
      ));
    }
    return ValidationResult.success();
  }
}

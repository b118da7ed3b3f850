package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Const schema - validates that a value equals a constant
public record ConstSchema(JsonNode constValue) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    return ArraySchema.canonicalize(json).equals(ArraySchema.canonicalize(constValue)) ?
        ValidationResult.success() :
        ValidationResult.failure(List.of(new ValidationError(path, "Value must equal const value")));
  }
}

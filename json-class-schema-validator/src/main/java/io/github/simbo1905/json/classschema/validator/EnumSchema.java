package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Enum schema - validates that a value is in a list of allowed values
public record EnumSchema(JsonSchema baseSchema, List<JsonNode> allowedValues) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    // First validate against base schema
    ValidationResult baseResult = baseSchema.validateAt(path, json, stack);
    if (!baseResult.valid()) {
      return baseResult;
    }

    String candidate = ArraySchema.canonicalize(json);
    for (JsonNode allowed : allowedValues) {
      if (ArraySchema.canonicalize(allowed).equals(candidate)) {
        return ValidationResult.success();
      }
    }
    return ValidationResult.failure(List.of(new ValidationError(path, "Not in enum")));
  }
}

package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Null schema - always valid for null values
public record NullSchema() implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isNull()) {
      return ValidationResult.failure(List.of(
          new ValidationError(path, "Expected null")
      ));
    }
    return ValidationResult.success();
  }
}

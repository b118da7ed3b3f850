package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Any schema - accepts all values
public record AnySchema() implements JsonSchema {
  static final AnySchema INSTANCE = new AnySchema();

  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    return ValidationResult.success();
  }
}

package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// AllOf composition - must satisfy all schemas
public record AllOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    // Push all subschemas onto the stack for validation
    for (JsonSchema schema : schemas) {
      stack.push(new ValidationFrame(path, schema, json));
    }
    return ValidationResult.success(); // Actual results emerge from stack processing
  }
}

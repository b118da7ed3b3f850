package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Not composition - inverts the validation result of the inner schema
public record NotSchema(JsonSchema schema) implements JsonSchema {
  /// The `false` schema; nothing validates against it
  static final NotSchema NOTHING = new NotSchema(AnySchema.INSTANCE);

  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    ValidationResult result = schema.validate(json);
    return result.valid() ?
        ValidationResult.failure(List.of(new ValidationError(path, "Schema should not match"))) :
        ValidationResult.success();
  }
}

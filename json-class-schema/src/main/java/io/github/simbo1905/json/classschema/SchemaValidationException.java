package io.github.simbo1905.json.classschema;

import io.github.simbo1905.json.classschema.validator.JsonSchema;

import java.util.List;
import java.util.stream.Collectors;

/// A JSON payload failed validation against a generated schema
public final class SchemaValidationException extends ClassSchemaException {
  private final List<JsonSchema.ValidationError> errors;

  public SchemaValidationException(List<JsonSchema.ValidationError> errors) {
    super("Validation failed: " + errors.stream().map(JsonSchema.ValidationError::toString).collect(Collectors.joining("; ")));
    this.errors = List.copyOf(errors);
  }

  public List<JsonSchema.ValidationError> errors() {
    return errors;
  }
}

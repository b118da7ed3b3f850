package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/// Root reference schema that refers back to the root schema
public record RootRef(Supplier<JsonSchema> rootSupplier) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    LOG.finest(() -> "RootRef.validateAt at path: " + path);
    JsonSchema root = rootSupplier.get();
    if (root == null) {
      return ValidationResult.failure(List.of(new ValidationError(path, "Root schema not available")));
    }
    stack.push(new ValidationFrame(path, root, json));
    return ValidationResult.success();
  }

  @Override
  public String toString() {
    return "RootRef";
  }
}

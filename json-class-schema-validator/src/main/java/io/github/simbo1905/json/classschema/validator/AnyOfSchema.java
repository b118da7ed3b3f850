package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// AnyOf composition - must satisfy at least one schema
public record AnyOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    List<ValidationError> collected = new ArrayList<>();

    for (JsonSchema schema : schemas) {
      LOG.finest(() -> "BRANCH START: " + schema.getClass().getSimpleName());
      List<ValidationError> branchErrors = Branches.run(path, schema, json);
      if (branchErrors.isEmpty()) {
        return ValidationResult.success();
      }
      collected.addAll(branchErrors);
      LOG.finest(() -> "BRANCH END: " + branchErrors.size() + " errors");
    }

    return ValidationResult.failure(collected);
  }
}

package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// OneOf composition - must satisfy exactly one schema
public record OneOfSchema(List<JsonSchema> schemas) implements JsonSchema {
  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    int validCount = 0;
    List<ValidationError> minimalErrors = null;

    for (JsonSchema schema : schemas) {
      List<ValidationError> branchErrors = Branches.run(path, schema, json);
      if (branchErrors.isEmpty()) {
        validCount++;
      } else if (minimalErrors == null || branchErrors.size() < minimalErrors.size()) {
        // Report the branch that came closest
        minimalErrors = branchErrors;
      }
      LOG.finest(() -> "one of BRANCH END: " + branchErrors.size() + " errors, valid=" + branchErrors.isEmpty());
    }

    if (validCount == 1) {
      return ValidationResult.success();
    } else if (validCount == 0) {
      return ValidationResult.failure(minimalErrors != null ? minimalErrors : List.of());
    } else {
      return ValidationResult.failure(List.of(
          new ValidationError(path, "oneOf: multiple schemas matched (" + validCount + ")")
      ));
    }
  }
}

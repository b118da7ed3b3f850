package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/// String schema with length and pattern constraints
public record StringSchema(
    Integer minLength,
    Integer maxLength,
    Pattern pattern,
    boolean typeAsserted
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isTextual()) {
      return typeAsserted
          ? ValidationResult.failure(List.of(new ValidationError(path, "Expected string")))
          : ValidationResult.success();
    }

    String value = json.textValue();
    List<ValidationError> errors = new ArrayList<>();

    // Lengths count code points, not UTF-16 units
    int length = value.codePointCount(0, value.length());
    if (minLength != null && length < minLength) {
      errors.add(new ValidationError(path, "String too short: expected at least " + minLength + " characters"));
    }
    if (maxLength != null && length > maxLength) {
      errors.add(new ValidationError(path, "String too long: expected at most " + maxLength + " characters"));
    }

    // Check pattern (unanchored matching - uses find() instead of matches())
    if (pattern != null && !pattern.matcher(value).find()) {
      errors.add(new ValidationError(path, "Pattern mismatch"));
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }
}

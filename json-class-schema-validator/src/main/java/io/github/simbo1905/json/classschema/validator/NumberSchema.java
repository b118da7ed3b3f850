package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Number schema with range and multiple constraints
///
/// @param integer when true the value must be mathematically integral, so `2.0` passes and `2.5` does not
public record NumberSchema(
    BigDecimal minimum,
    BigDecimal maximum,
    BigDecimal exclusiveMinimum,
    BigDecimal exclusiveMaximum,
    BigDecimal multipleOf,
    boolean integer,
    boolean typeAsserted
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    LOG.finest(() -> "NumberSchema.validateAt: " + json + " minimum=" + minimum + " maximum=" + maximum);
    if (!json.isNumber()) {
      return typeAsserted
          ? ValidationResult.failure(List.of(new ValidationError(path, integer ? "Expected integer" : "Expected number")))
          : ValidationResult.success();
    }

    BigDecimal value = json.decimalValue();
    List<ValidationError> errors = new ArrayList<>();

    if (integer && !isIntegral(value)) {
      errors.add(new ValidationError(path, "Expected integer"));
    }
    if (minimum != null && value.compareTo(minimum) < 0) {
      errors.add(new ValidationError(path, "Below minimum"));
    }
    if (exclusiveMinimum != null && value.compareTo(exclusiveMinimum) <= 0) {
      errors.add(new ValidationError(path, "Below minimum"));
    }
    if (maximum != null && value.compareTo(maximum) > 0) {
      errors.add(new ValidationError(path, "Above maximum"));
    }
    if (exclusiveMaximum != null && value.compareTo(exclusiveMaximum) >= 0) {
      errors.add(new ValidationError(path, "Above maximum"));
    }
    if (multipleOf != null && multipleOf.signum() != 0) {
      BigDecimal remainder = value.remainder(multipleOf);
      if (remainder.compareTo(BigDecimal.ZERO) != 0) {
        errors.add(new ValidationError(path, "Not multiple of " + multipleOf));
      }
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }

  static boolean isIntegral(BigDecimal value) {
    return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
  }
}

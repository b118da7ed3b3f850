package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/// Object schema with properties, required fields, and constraints
///
/// @param typeAsserted when false the schema came from object keywords without
///                     `"type":"object"` and lets non-object values through
public record ObjectSchema(
    Map<String, JsonSchema> properties,
    Set<String> required,
    JsonSchema additionalProperties,
    Integer minProperties,
    Integer maxProperties,
    Map<Pattern, JsonSchema> patternProperties,
    boolean typeAsserted
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isObject()) {
      return typeAsserted
          ? ValidationResult.failure(List.of(new ValidationError(path, "Expected object")))
          : ValidationResult.success();
    }

    List<ValidationError> errors = new ArrayList<>();

    // Check property count constraints
    int propCount = json.size();
    if (minProperties != null && propCount < minProperties) {
      errors.add(new ValidationError(path, "Too few properties: expected at least " + minProperties));
    }
    if (maxProperties != null && propCount > maxProperties) {
      errors.add(new ValidationError(path, "Too many properties: expected at most " + maxProperties));
    }

    // Check required properties
    for (String reqProp : required) {
      if (!json.has(reqProp)) {
        errors.add(new ValidationError(path, "Missing required property: " + reqProp));
      }
    }

    // Validate each property with correct precedence
    Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      String propName = entry.getKey();
      JsonNode propValue = entry.getValue();
      String propPath = path.isEmpty() ? propName : path + "." + propName;

      boolean handled = false;

      // 1. Check if property is in properties (highest precedence)
      JsonSchema propSchema = properties.get(propName);
      if (propSchema != null) {
        stack.push(new ValidationFrame(propPath, propSchema, propValue));
        handled = true;
      }

      // 2. Check all patternProperties that match this property name
      if (patternProperties != null) {
        for (var patternEntry : patternProperties.entrySet()) {
          if (patternEntry.getKey().matcher(propName).find()) { // unanchored find semantics
            stack.push(new ValidationFrame(propPath, patternEntry.getValue(), propValue));
            handled = true;
          }
        }
      }

      // 3. If property wasn't handled by properties or patternProperties, apply additionalProperties
      if (!handled && additionalProperties != null) {
        if (additionalProperties == NotSchema.NOTHING) {
          errors.add(new ValidationError(propPath, "Additional properties not allowed"));
        } else if (additionalProperties != AnySchema.INSTANCE) {
          stack.push(new ValidationFrame(propPath, additionalProperties, propValue));
        }
      }
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }
}

package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/// Array schema with item validation and constraints
///
/// `items` applies to every position after `prefixItems`, as in draft 2020-12.
public record ArraySchema(
    JsonSchema items,
    List<JsonSchema> prefixItems,
    Integer minItems,
    Integer maxItems,
    Boolean uniqueItems,
    boolean typeAsserted
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(String path, JsonNode json, Deque<ValidationFrame> stack) {
    if (!json.isArray()) {
      return typeAsserted
          ? ValidationResult.failure(List.of(new ValidationError(path, "Expected array")))
          : ValidationResult.success();
    }

    List<ValidationError> errors = new ArrayList<>();
    int itemCount = json.size();

    // Check item count constraints
    if (minItems != null && itemCount < minItems) {
      errors.add(new ValidationError(path, "Too few items: expected at least " + minItems));
    }
    if (maxItems != null && itemCount > maxItems) {
      errors.add(new ValidationError(path, "Too many items: expected at most " + maxItems));
    }

    // Check uniqueness if required (structural equality)
    if (uniqueItems != null && uniqueItems) {
      Set<String> seen = new HashSet<>();
      for (JsonNode item : json) {
        if (!seen.add(canonicalize(item))) {
          errors.add(new ValidationError(path, "Array items must be unique"));
          break;
        }
      }
    }

    int prefixCount = prefixItems == null ? 0 : Math.min(prefixItems.size(), itemCount);
    for (int i = 0; i < prefixCount; i++) {
      stack.push(new ValidationFrame(path + "[" + i + "]", prefixItems.get(i), json.get(i)));
    }
    if (items != null && items != AnySchema.INSTANCE) {
      for (int i = prefixCount; i < itemCount; i++) {
        if (items == NotSchema.NOTHING) {
          errors.add(new ValidationError(path + "[" + i + "]", "Additional items not allowed"));
        } else {
          stack.push(new ValidationFrame(path + "[" + i + "]", items, json.get(i)));
        }
      }
    }

    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }

  /// Canonicalization helper for structural equality in uniqueItems, enum and const.
  /// Numbers compare by mathematical value so `1` and `1.0` are the same.
  static String canonicalize(JsonNode v) {
    if (v.isObject()) {
      List<String> keys = new ArrayList<>();
      Iterator<String> names = v.fieldNames();
      names.forEachRemaining(keys::add);
      Collections.sort(keys);
      StringBuilder sb = new StringBuilder("{");
      for (int i = 0; i < keys.size(); i++) {
        String k = keys.get(i);
        if (i > 0) sb.append(',');
        sb.append('"').append(escapeJsonString(k)).append("\":").append(canonicalize(v.get(k)));
      }
      return sb.append('}').toString();
    }
    if (v.isArray()) {
      StringBuilder sb = new StringBuilder("[");
      for (int i = 0; i < v.size(); i++) {
        if (i > 0) sb.append(',');
        sb.append(canonicalize(v.get(i)));
      }
      return sb.append(']').toString();
    }
    if (v.isTextual()) {
      return "\"" + escapeJsonString(v.textValue()) + "\"";
    }
    if (v.isNumber()) {
      return v.decimalValue().stripTrailingZeros().toPlainString();
    }
    return v.toString();
  }

  static String escapeJsonString(String s) {
    if (s == null) return "null";
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      switch (ch) {
        case '"':
          result.append("\\\"");
          break;
        case '\\':
          result.append("\\\\");
          break;
        case '\n':
          result.append("\\n");
          break;
        case '\r':
          result.append("\\r");
          break;
        case '\t':
          result.append("\\t");
          break;
        default:
          if (ch < 0x20) {
            result.append("\\u").append(String.format("%04x", (int) ch));
          } else {
            result.append(ch);
          }
      }
    }
    return result.toString();
  }
}

package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Schema-less JSON to native mapping used by dictionaries and untyped arrays
final class GenericValues {

  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private GenericValues() {}

  static Object toNative(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber()) {
      BigInteger value = node.bigIntegerValue();
      if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
        return value.longValue();
      }
      return value;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    if (node.isArray()) {
      List<Object> values = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        values.add(toNative(element));
      }
      return array(values);
    }
    if (node.isObject()) {
      return dictionary(node);
    }
    throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
  }

  static Map<String, Object> dictionary(JsonNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      map.put(field.getKey(), toNative(field.getValue()));
    }
    return map;
  }

  /// A typed array when every element has the same non-nil kind, otherwise a plain list
  static Object array(List<Object> values) {
    if (values.isEmpty()) {
      return Collections.unmodifiableList(new ArrayList<>());
    }
    ValueKind first = ValueKind.of(values.get(0));
    if (first != ValueKind.NIL) {
      boolean homogeneous = true;
      for (Object value : values) {
        if (ValueKind.of(value) != first) {
          homogeneous = false;
          break;
        }
      }
      if (homogeneous) {
        return new TypedArray(ElementType.of(first), values);
      }
    }
    return Collections.unmodifiableList(new ArrayList<>(values));
  }
}

package io.github.simbo1905.json.classschema;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/// Coarse value kind as reported by the host's reflection model.
public enum ValueKind {
  NIL,
  BOOL,
  INT,
  FLOAT,
  STRING,
  VECTOR2,
  VECTOR2I,
  RECT2,
  RECT2I,
  VECTOR3,
  VECTOR3I,
  TRANSFORM2D,
  VECTOR4,
  VECTOR4I,
  PLANE,
  QUATERNION,
  AABB,
  BASIS,
  TRANSFORM3D,
  PROJECTION,
  COLOR,
  STRING_NAME,
  NODE_PATH,
  RID,
  OBJECT,
  CALLABLE,
  SIGNAL,
  DICTIONARY,
  ARRAY,
  PACKED_BYTE_ARRAY,
  PACKED_INT32_ARRAY,
  PACKED_INT64_ARRAY,
  PACKED_FLOAT32_ARRAY,
  PACKED_FLOAT64_ARRAY,
  PACKED_STRING_ARRAY,
  PACKED_VECTOR2_ARRAY,
  PACKED_VECTOR3_ARRAY,
  PACKED_COLOR_ARRAY,
  PACKED_VECTOR4_ARRAY;

  /// The catalog composite carried by this kind, if any
  public Optional<BuiltinType> builtin() {
    for (BuiltinType type : BuiltinType.values()) {
      if (type.kind() == this) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /// Kind of a native value produced by instantiation
  public static ValueKind of(Object value) {
    if (value == null) {
      return NIL;
    }
    if (value instanceof Boolean) {
      return BOOL;
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger) {
      return INT;
    }
    if (value instanceof Double || value instanceof Float) {
      return FLOAT;
    }
    if (value instanceof CharSequence) {
      return STRING;
    }
    if (value instanceof CompositeValue composite) {
      return composite.type().kind();
    }
    if (value instanceof Map) {
      return DICTIONARY;
    }
    if (value instanceof TypedArray || value instanceof Collection) {
      return ARRAY;
    }
    return OBJECT;
  }
}

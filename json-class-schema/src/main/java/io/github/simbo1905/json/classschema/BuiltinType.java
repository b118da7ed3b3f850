package io.github.simbo1905.json.classschema;

import java.util.List;
import java.util.Optional;

/// Fixed catalog of composite value types that have no reflective property list.
///
/// Each entry decomposes into a structural [#sourceDefinition()] that is only
/// used for its own `$defs` entry, and names the other entries that definition
/// mentions in [#dependencies()]. The dependency graph is acyclic.
public enum BuiltinType {
  VECTOR2("Vector2", ValueKind.VECTOR2),
  VECTOR2I("Vector2i", ValueKind.VECTOR2I),
  RECT2("Rect2", ValueKind.RECT2),
  RECT2I("Rect2i", ValueKind.RECT2I),
  VECTOR3("Vector3", ValueKind.VECTOR3),
  VECTOR3I("Vector3i", ValueKind.VECTOR3I),
  TRANSFORM2D("Transform2D", ValueKind.TRANSFORM2D),
  VECTOR4("Vector4", ValueKind.VECTOR4),
  VECTOR4I("Vector4i", ValueKind.VECTOR4I),
  PLANE("Plane", ValueKind.PLANE),
  QUATERNION("Quaternion", ValueKind.QUATERNION),
  AABB("Aabb", ValueKind.AABB),
  BASIS("Basis", ValueKind.BASIS),
  TRANSFORM3D("Transform3D", ValueKind.TRANSFORM3D),
  PROJECTION("Projection", ValueKind.PROJECTION),
  COLOR("Color", ValueKind.COLOR),
  RID("Rid", ValueKind.RID),
  PACKED_BYTE_ARRAY("PackedByteArray", ValueKind.PACKED_BYTE_ARRAY),
  PACKED_INT32_ARRAY("PackedInt32Array", ValueKind.PACKED_INT32_ARRAY),
  PACKED_INT64_ARRAY("PackedInt64Array", ValueKind.PACKED_INT64_ARRAY),
  PACKED_FLOAT32_ARRAY("PackedFloat32Array", ValueKind.PACKED_FLOAT32_ARRAY),
  PACKED_FLOAT64_ARRAY("PackedFloat64Array", ValueKind.PACKED_FLOAT64_ARRAY),
  PACKED_STRING_ARRAY("PackedStringArray", ValueKind.PACKED_STRING_ARRAY),
  PACKED_VECTOR2_ARRAY("PackedVector2Array", ValueKind.PACKED_VECTOR2_ARRAY),
  PACKED_VECTOR3_ARRAY("PackedVector3Array", ValueKind.PACKED_VECTOR3_ARRAY),
  PACKED_COLOR_ARRAY("PackedColorArray", ValueKind.PACKED_COLOR_ARRAY),
  PACKED_VECTOR4_ARRAY("PackedVector4Array", ValueKind.PACKED_VECTOR4_ARRAY);

  private final String schemaName;
  private final ValueKind kind;

  BuiltinType(String schemaName, ValueKind kind) {
    this.schemaName = schemaName;
    this.kind = kind;
  }

  /// Canonical `$defs` key
  public String schemaName() {
    return schemaName;
  }

  public ValueKind kind() {
    return kind;
  }

  public static Optional<BuiltinType> bySchemaName(String name) {
    for (BuiltinType type : values()) {
      if (type.schemaName.equals(name)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /// Structural decomposition emitted as this type's `$defs` entry
  public Definition sourceDefinition() {
    return switch (this) {
      case VECTOR2 -> floats(FloatWidth.FLOAT32, "x", "y");
      case VECTOR2I -> ints(IntegerWidth.INT32, "x", "y");
      case RECT2 -> composites(VECTOR2, "position", "size");
      case RECT2I -> composites(VECTOR2I, "position", "size");
      case VECTOR3 -> floats(FloatWidth.FLOAT32, "x", "y", "z");
      case VECTOR3I -> ints(IntegerWidth.INT32, "x", "y", "z");
      case TRANSFORM2D -> composites(VECTOR2, "a", "b", "origin");
      case VECTOR4 -> floats(FloatWidth.FLOAT32, "x", "y", "z", "w");
      case VECTOR4I -> ints(IntegerWidth.INT32, "x", "y", "z", "w");
      case PLANE -> JObject.builder()
          .property("normal", new JBuiltin(VECTOR3))
          .property("d", new JNumber(FloatWidth.FLOAT32))
          .build();
      case QUATERNION -> floats(FloatWidth.FLOAT32, "x", "y", "z", "w");
      case AABB -> composites(VECTOR3, "position", "size");
      case BASIS -> JObject.builder()
          .property("rows", JTuple.repeat(new JBuiltin(VECTOR3), 3))
          .build();
      case TRANSFORM3D -> JObject.builder()
          .property("basis", new JBuiltin(BASIS))
          .property("origin", new JBuiltin(VECTOR3))
          .build();
      case PROJECTION -> JObject.builder()
          .property("cols", JTuple.repeat(new JBuiltin(VECTOR4), 4))
          .build();
      case COLOR -> floats(FloatWidth.FLOAT32, "r", "g", "b", "a");
      case RID -> new JInteger(IntegerWidth.UINT64);
      case PACKED_BYTE_ARRAY -> new JArray(new JInteger(IntegerWidth.UINT8));
      case PACKED_INT32_ARRAY -> new JArray(new JInteger(IntegerWidth.INT32));
      case PACKED_INT64_ARRAY -> new JArray(new JInteger(IntegerWidth.INT64));
      case PACKED_FLOAT32_ARRAY -> new JArray(new JNumber(FloatWidth.FLOAT32));
      case PACKED_FLOAT64_ARRAY -> new JArray(new JNumber(FloatWidth.FLOAT64));
      case PACKED_STRING_ARRAY -> new JArray(new JString());
      case PACKED_VECTOR2_ARRAY -> new JArray(new JBuiltin(VECTOR2));
      case PACKED_VECTOR3_ARRAY -> new JArray(new JBuiltin(VECTOR3));
      case PACKED_COLOR_ARRAY -> new JArray(new JBuiltin(COLOR));
      case PACKED_VECTOR4_ARRAY -> new JArray(new JBuiltin(VECTOR4));
    };
  }

  /// Catalog entries the source definition mentions
  public List<BuiltinType> dependencies() {
    return switch (this) {
      case RECT2, TRANSFORM2D, PACKED_VECTOR2_ARRAY -> List.of(VECTOR2);
      case RECT2I -> List.of(VECTOR2I);
      case PLANE, AABB, BASIS, PACKED_VECTOR3_ARRAY -> List.of(VECTOR3);
      case TRANSFORM3D -> List.of(BASIS, VECTOR3);
      case PROJECTION, PACKED_VECTOR4_ARRAY -> List.of(VECTOR4);
      case PACKED_COLOR_ARRAY -> List.of(COLOR);
      default -> List.of();
    };
  }

  private static JObject floats(FloatWidth width, String... names) {
    JObject.Builder builder = JObject.builder();
    for (String name : names) {
      builder.property(name, new JNumber(width));
    }
    return builder.build();
  }

  private static JObject ints(IntegerWidth width, String... names) {
    JObject.Builder builder = JObject.builder();
    for (String name : names) {
      builder.property(name, new JInteger(width));
    }
    return builder.build();
  }

  private static JObject composites(BuiltinType type, String... names) {
    JObject.Builder builder = JObject.builder();
    for (String name : names) {
      builder.property(name, new JBuiltin(type));
    }
    return builder.build();
  }
}

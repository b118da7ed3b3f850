package io.github.simbo1905.json.classschema;

import java.util.Objects;

/// Element type of a [TypedArray]
///
/// @param kind element value kind
/// @param className class definition name for `OBJECT` elements, otherwise `null`
public record ElementType(ValueKind kind, String className) {
  public ElementType {
    Objects.requireNonNull(kind, "kind");
  }

  public static ElementType of(ValueKind kind) {
    return new ElementType(kind, null);
  }
}

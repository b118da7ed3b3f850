package io.github.simbo1905.json.classschema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Native value of a catalog composite.
///
/// The payload mirrors the source definition: a field map for struct-like
/// types, a [TypedArray] for packed arrays, a `Long` for `Rid`.
public record CompositeValue(BuiltinType type, Object payload) {
  public CompositeValue {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> fields() {
    if (!(payload instanceof Map)) {
      throw new IllegalStateException(type.schemaName() + " has no fields");
    }
    return (Map<String, Object>) payload;
  }

  public Object field(String name) {
    return fields().get(name);
  }

  public List<Object> elements() {
    if (!(payload instanceof TypedArray)) {
      throw new IllegalStateException(type.schemaName() + " is not an array type");
    }
    return ((TypedArray) payload).values();
  }

  public long longValue() {
    if (!(payload instanceof Long)) {
      throw new IllegalStateException(type.schemaName() + " is not an integer type");
    }
    return (Long) payload;
  }
}

package io.github.simbo1905.json.classschema;

import java.util.Map;
import java.util.Objects;

/// Named pointer into the definitions table. Used for classes and enums so that
/// shared and recursive graphs serialize once.
public record JRef(String name) implements Type {

  static final String DEFS_POINTER = "#/$defs/";

  public JRef {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("reference name must not be empty");
    }
  }

  @Override
  public Definition resolve(Map<String, Definition> defs) {
    Definition target = defs.get(name);
    if (target == null) {
      StructuredLog.error(ClassSchemaLogging.LOG, "dangling.ref", "name", name, "known", defs.keySet());
      throw new DanglingReferenceException(name);
    }
    return target;
  }

  /// The `$ref` value, with the name escaped as a JSON Pointer token
  public String pointer() {
    return pointerTo(name);
  }

  static String pointerTo(String name) {
    return DEFS_POINTER + name.replace("~", "~0").replace("/", "~1");
  }
}

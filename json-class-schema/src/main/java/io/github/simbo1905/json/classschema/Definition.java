package io.github.simbo1905.json.classschema;

import java.util.Map;

/// One node of the schema IR describing a JSON shape.
///
/// Every pass over the IR is a [DefinitionVisitor], so a new variant cannot be
/// added without the serializer, the instantiator and the closure walk all
/// failing to compile until they handle it.
public sealed interface Definition extends Type
    permits JNull, JBoolean, JInteger, JNumber, JString, JObject, JArray, JTuple, JEnum, JClass, JBuiltin {

  /// Optional human-readable description, `null` when absent
  String description();

  /// Copy of this definition carrying the given description
  Definition withDescription(String description);

  <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg);

  @Override
  default Definition resolve(Map<String, Definition> defs) {
    return this;
  }

  /// Whether the serialized form is already a JSON object at the root
  default boolean isObjectShaped() {
    return false;
  }
}

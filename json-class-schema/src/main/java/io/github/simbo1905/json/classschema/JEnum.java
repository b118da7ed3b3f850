package io.github.simbo1905.json.classschema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Named enum serialized as a string enum of its variant names.
/// Variants keep the host's declaration order.
///
/// @param name canonical `Class.Enum` path
public record JEnum(String name, Map<String, Long> variants, String description) implements Definition {
  public JEnum {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(variants, "variants");
    if (variants.isEmpty()) {
      throw new IllegalArgumentException("enum " + name + " has no variants");
    }
    variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
  }

  public JEnum(String name, Map<String, Long> variants) {
    this(name, variants, null);
  }

  @Override
  public JEnum withDescription(String description) {
    return new JEnum(name, variants, description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitEnum(this, arg);
  }
}

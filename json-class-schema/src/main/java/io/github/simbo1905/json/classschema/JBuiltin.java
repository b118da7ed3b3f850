package io.github.simbo1905.json.classschema;

import java.util.Objects;

/// Reference to a catalog composite; always emitted as a `$ref` to its `$defs` entry.
public record JBuiltin(BuiltinType type, String description) implements Definition {
  public JBuiltin {
    Objects.requireNonNull(type, "type");
  }

  public JBuiltin(BuiltinType type) {
    this(type, null);
  }

  @Override
  public JBuiltin withDescription(String description) {
    return new JBuiltin(type, description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitBuiltin(this, arg);
  }
}

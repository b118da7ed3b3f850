package io.github.simbo1905.json.classschema;

import java.util.Optional;

/// Array with an optional item type; `items == null` means heterogeneous.
public record JArray(Type items, String description) implements Definition {

  public JArray(Type items) {
    this(items, null);
  }

  public static JArray untyped() {
    return new JArray(null, null);
  }

  public Optional<Type> itemType() {
    return Optional.ofNullable(items);
  }

  @Override
  public JArray withDescription(String description) {
    return new JArray(items, description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitArray(this, arg);
  }
}

package io.github.simbo1905.json.classschema;

import java.util.Objects;

/// Integer slot. The width only matters on the way back in: the emitted schema
/// is always `{"type":"integer"}`.
public record JInteger(IntegerWidth width, String description) implements Definition {
  public JInteger {
    Objects.requireNonNull(width, "width");
  }

  public JInteger() {
    this(IntegerWidth.ANY64, null);
  }

  public JInteger(IntegerWidth width) {
    this(width, null);
  }

  @Override
  public JInteger withDescription(String description) {
    return new JInteger(width, description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitInteger(this, arg);
  }
}

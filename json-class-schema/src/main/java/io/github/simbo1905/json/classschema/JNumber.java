package io.github.simbo1905.json.classschema;

import java.util.Objects;

public record JNumber(FloatWidth width, String description) implements Definition {
  public JNumber {
    Objects.requireNonNull(width, "width");
  }

  public JNumber() {
    this(FloatWidth.FLOAT64, null);
  }

  public JNumber(FloatWidth width) {
    this(width, null);
  }

  @Override
  public JNumber withDescription(String description) {
    return new JNumber(width, description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitNumber(this, arg);
  }
}

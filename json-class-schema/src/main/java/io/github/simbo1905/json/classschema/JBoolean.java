package io.github.simbo1905.json.classschema;

public record JBoolean(String description) implements Definition {
  public JBoolean() {
    this(null);
  }

  @Override
  public JBoolean withDescription(String description) {
    return new JBoolean(description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitBoolean(this, arg);
  }
}

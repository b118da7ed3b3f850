package io.github.simbo1905.json.classschema;

public record JString(String description) implements Definition {
  public JString() {
    this(null);
  }

  @Override
  public JString withDescription(String description) {
    return new JString(description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitString(this, arg);
  }
}

package io.github.simbo1905.json.classschema;

/// JSON `null`. Also the placeholder element of an array hinted with an empty type.
public record JNull(String description) implements Definition {
  public JNull() {
    this(null);
  }

  @Override
  public JNull withDescription(String description) {
    return new JNull(description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitNull(this, arg);
  }
}

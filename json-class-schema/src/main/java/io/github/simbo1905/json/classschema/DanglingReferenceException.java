package io.github.simbo1905.json.classschema;

/// A [JRef] names an entry that the definitions table does not have
public final class DanglingReferenceException extends ClassSchemaException {
  private final String name;

  public DanglingReferenceException(String name) {
    super("Dangling reference: " + name);
    this.name = name;
  }

  public String name() {
    return name;
  }
}

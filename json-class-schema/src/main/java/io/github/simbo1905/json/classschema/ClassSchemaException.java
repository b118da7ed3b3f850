package io.github.simbo1905.json.classschema;

/// Base of every failure raised by schema generation, compilation and instantiation
public class ClassSchemaException extends RuntimeException {
  public ClassSchemaException(String message) {
    super(message);
  }

  public ClassSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}

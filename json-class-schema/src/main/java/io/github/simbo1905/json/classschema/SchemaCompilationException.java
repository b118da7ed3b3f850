package io.github.simbo1905.json.classschema;

/// The validation engine rejected a generated document
public final class SchemaCompilationException extends ClassSchemaException {
  public SchemaCompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}

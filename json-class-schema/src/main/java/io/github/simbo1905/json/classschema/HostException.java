package io.github.simbo1905.json.classschema;

/// The host failed to reflect, construct or assign
public class HostException extends ClassSchemaException {
  public HostException(String message) {
    super(message);
  }

  public HostException(String message, Throwable cause) {
    super(message, cause);
  }
}

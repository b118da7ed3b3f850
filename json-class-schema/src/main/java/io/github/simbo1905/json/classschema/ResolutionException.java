package io.github.simbo1905.json.classschema;

import java.util.Objects;

/// A property type could not be turned into a schema type
public final class ResolutionException extends ClassSchemaException {

  public enum Reason {
    /// enum path is not exactly `Class.Enum`
    ENUM_PATH_MALFORMED,
    CLASS_NOT_FOUND,
    ENUM_NOT_FOUND,
    /// array hint payload names nothing the host knows
    UNSUPPORTED_HINT,
    /// value kind has no schema mapping
    UNSUPPORTED_KIND,
    DEPTH_EXCEEDED
  }

  private final Reason reason;

  public ResolutionException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Reason reason() {
    return reason;
  }
}

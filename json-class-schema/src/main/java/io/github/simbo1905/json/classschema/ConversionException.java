package io.github.simbo1905.json.classschema;

import java.util.Objects;

/// A JSON value could not be converted into a native value.
///
/// [#path()] locates the failing value, e.g. `$.pets[1].name`.
public final class ConversionException extends ClassSchemaException {

  public enum Reason {
    TYPE_MISMATCH,
    EXPECTED_INTEGER_GOT_FLOAT,
    INTEGER_OUT_OF_RANGE,
    PROPERTY_COUNT_MISMATCH,
    MISSING_PROPERTY,
    UNKNOWN_PROPERTY,
    TUPLE_ARITY_MISMATCH,
    UNKNOWN_VARIANT,
    DEPTH_EXCEEDED,
    MALFORMED_JSON
  }

  private final Reason reason;
  private final String path;

  public ConversionException(Reason reason, String path, String message) {
    this(reason, path, message, null);
  }

  public ConversionException(Reason reason, String path, String message, Throwable cause) {
    super(path + ": " + message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.path = Objects.requireNonNull(path, "path");
  }

  public Reason reason() {
    return reason;
  }

  public String path() {
    return path;
  }
}

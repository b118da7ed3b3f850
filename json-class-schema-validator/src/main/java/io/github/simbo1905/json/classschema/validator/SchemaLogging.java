package io.github.simbo1905.json.classschema.validator;

import java.util.logging.Logger;

/// Centralized logger for the validation engine.
/// All classes must use this logger via:
///   import static io.github.simbo1905.json.classschema.validator.SchemaLogging.LOG;
final class SchemaLogging {
  public static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.classschema.validator");
  private SchemaLogging() {}
}

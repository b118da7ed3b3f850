package io.github.simbo1905.json.classschema;

import java.util.logging.Logger;

/// Centralized logger for schema generation and instantiation.
/// All classes must use this logger via:
///   import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;
final class ClassSchemaLogging {
  public static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.classschema");
  private ClassSchemaLogging() {}
}

package io.github.simbo1905.json.classschema.beans;

import java.util.logging.Logger;

/// Centralized logger for the Java bean host.
/// All classes must use this logger via:
///   import static io.github.simbo1905.json.classschema.beans.BeanHostLogging.LOG;
final class BeanHostLogging {
  public static final Logger LOG = Logger.getLogger("io.github.simbo1905.json.classschema.beans");
  private BeanHostLogging() {}
}

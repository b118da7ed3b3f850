package io.github.simbo1905.json.classschema;

/// Write side of the host runtime. How instances come to exist is entirely the host's business.
public interface ObjectFactory {

  /// New blank instance of the class
  Object construct(ClassSource source);

  /// Assign a converted native value to a property of an instance
  void setProperty(Object handle, String name, Object value);
}

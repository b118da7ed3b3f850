package io.github.simbo1905.json.classschema;

/// Hint kind attached to a reflected property; the hint string means different things per kind.
public enum PropertyHint {
  NONE,
  /// hint string names the element type of an array
  ARRAY_TYPE,
  /// hint string names the class of an object reference
  RESOURCE_TYPE,
  /// hint string lists enum labels for display only
  ENUM,
  TYPE_STRING
}

package io.github.simbo1905.json.classschema;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// One entry of a host's reflective property list.
///
/// @param name property name
/// @param kind coarse value kind
/// @param className secondary name: a class name for object references, a `Class.Enum` path for enums
/// @param hint hint kind
/// @param hintString hint payload, interpreted per hint kind
/// @param usage usage flags
public record PropertyDescriptor(
    String name,
    ValueKind kind,
    String className,
    PropertyHint hint,
    String hintString,
    Set<PropertyUsage> usage
) {
  public PropertyDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    className = className == null ? "" : className;
    hint = hint == null ? PropertyHint.NONE : hint;
    hintString = hintString == null ? "" : hintString;
    usage = usage == null || usage.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(usage));
  }

  /// Plain stored property of the given kind
  public static PropertyDescriptor of(String name, ValueKind kind) {
    return new PropertyDescriptor(name, kind, "", PropertyHint.NONE, "", Set.of(PropertyUsage.STORAGE));
  }

  /// Object reference to a class
  public static PropertyDescriptor object(String name, String className) {
    return new PropertyDescriptor(name, ValueKind.OBJECT, className, PropertyHint.NONE, "", Set.of(PropertyUsage.STORAGE));
  }

  /// Integer that stores an enum, e.g. `Person.Gender`
  public static PropertyDescriptor enumeration(String name, String enumPath) {
    return new PropertyDescriptor(name, ValueKind.INT, enumPath, PropertyHint.NONE, "",
        Set.of(PropertyUsage.STORAGE, PropertyUsage.CLASS_IS_ENUM));
  }

  /// Array whose element type is spelled in the hint string
  public static PropertyDescriptor typedArray(String name, String elementType) {
    return new PropertyDescriptor(name, ValueKind.ARRAY, "", PropertyHint.ARRAY_TYPE, elementType, Set.of(PropertyUsage.STORAGE));
  }

  public boolean hasUsage(PropertyUsage flag) {
    return usage.contains(flag);
  }
}

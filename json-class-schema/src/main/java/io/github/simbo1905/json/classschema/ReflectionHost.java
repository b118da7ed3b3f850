package io.github.simbo1905.json.classschema;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Read side of the host runtime: class lookup and property enumeration.
public interface ReflectionHost {

  /// Look a class up by its global name
  Optional<ClassSource> findClass(String className);

  /// Ordered property list of a class
  ///
  /// @throws HostException when the host cannot reflect on the class
  List<PropertyDescriptor> propertyList(ClassSource source);

  /// Ordered variant name to value map of an enum declared on `owner`; empty when there is no such enum
  Map<String, Long> enumVariants(ClassSource owner, String enumName);

  /// Human-readable class description, when the host has one
  default Optional<String> description(ClassSource source) {
    return Optional.empty();
  }

  /// Human-readable description of one property. Only inline property types carry it;
  /// classes and enums are described by their own definition.
  default Optional<String> propertyDescription(ClassSource source, String propertyName) {
    return Optional.empty();
  }
}

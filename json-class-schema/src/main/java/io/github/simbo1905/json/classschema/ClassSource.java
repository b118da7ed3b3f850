package io.github.simbo1905.json.classschema;

import java.util.Objects;

/// Identity of a reflectable class. Doubles as the definitions-table key and the cache key.
public sealed interface ClassSource permits ClassSource.Named, ClassSource.Unnamed {

  /// Canonical name used in `$defs`
  String definitionName();

  static ClassSource named(String name) {
    return new Named(name);
  }

  static ClassSource unnamed(String location) {
    return new Unnamed(location);
  }

  /// Class registered under a stable global name
  record Named(String name) implements ClassSource {
    public Named {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) {
        throw new IllegalArgumentException("class name must not be blank");
      }
    }

    @Override
    public String definitionName() {
      return name;
    }
  }

  /// Class known only by where it is stored, e.g. an anonymous script file
  record Unnamed(String location) implements ClassSource {
    public Unnamed {
      Objects.requireNonNull(location, "location");
      if (location.isBlank()) {
        throw new IllegalArgumentException("class location must not be blank");
      }
    }

    @Override
    public String definitionName() {
      return location;
    }
  }
}

package io.github.simbo1905.json.classschema;

import java.util.Map;

/// A property or item type: either an inline [Definition] or a [JRef] into the defs table.
public sealed interface Type permits Definition, JRef {

  /// Resolve this type against a definitions table.
  ///
  /// @throws DanglingReferenceException when a reference names a missing entry
  Definition resolve(Map<String, Definition> defs);
}

package io.github.simbo1905.json.classschema;

import java.util.EnumSet;
import java.util.Set;

public enum PropertyUsage {
  STORAGE,
  EDITOR,
  SCRIPT_VARIABLE,
  /// the integer property is really an enum and its class name is a `Class.Enum` path
  CLASS_IS_ENUM,
  CLASS_IS_BITFIELD,
  CATEGORY,
  GROUP,
  SUBGROUP;

  /// Editor layout entries that are listed like properties but hold no value
  static final Set<PropertyUsage> GROUPING = EnumSet.of(CATEGORY, GROUP, SUBGROUP);
}

package io.github.simbo1905.json.classschema;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Options for generation and instantiation
///
/// @param excludedPropertyPattern property names matching this are not part of the schema
/// @param maxGenerationDepth deepest class nesting followed while generating
/// @param maxInstantiationDepth deepest JSON nesting converted while instantiating
public record SchemaOptions(Pattern excludedPropertyPattern, int maxGenerationDepth, int maxInstantiationDepth) {

  /// Script file properties such as `Person.gd`
  public static final String DEFAULT_EXCLUDE = ".*\\.gd$";
  public static final int DEFAULT_MAX_GENERATION_DEPTH = 64;
  public static final int DEFAULT_MAX_INSTANTIATION_DEPTH = 512;

  public static final String EXCLUDE_PROPERTY = "classschema.exclude.pattern";
  public static final String MAX_GENERATION_DEPTH_PROPERTY = "classschema.max.generation.depth";
  public static final String MAX_INSTANTIATION_DEPTH_PROPERTY = "classschema.max.instantiation.depth";

  public static final SchemaOptions DEFAULT = new SchemaOptions(
      Pattern.compile(DEFAULT_EXCLUDE), DEFAULT_MAX_GENERATION_DEPTH, DEFAULT_MAX_INSTANTIATION_DEPTH);

  public SchemaOptions {
    Objects.requireNonNull(excludedPropertyPattern, "excludedPropertyPattern");
    if (maxGenerationDepth <= 0) {
      throw new IllegalArgumentException("maxGenerationDepth must be > 0");
    }
    if (maxInstantiationDepth <= 0) {
      throw new IllegalArgumentException("maxInstantiationDepth must be > 0");
    }
  }

  /// Defaults overridden by any `classschema.*` system properties that are set
  public static SchemaOptions fromSystemProperties() {
    String exclude = System.getProperty(EXCLUDE_PROPERTY, DEFAULT_EXCLUDE);
    Pattern pattern;
    try {
      pattern = Pattern.compile(exclude);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid " + EXCLUDE_PROPERTY + ": " + exclude, e);
    }
    return new SchemaOptions(
        pattern,
        intProperty(MAX_GENERATION_DEPTH_PROPERTY, DEFAULT_MAX_GENERATION_DEPTH),
        intProperty(MAX_INSTANTIATION_DEPTH_PROPERTY, DEFAULT_MAX_INSTANTIATION_DEPTH));
  }

  public SchemaOptions withExcludedPropertyPattern(String regex) {
    return new SchemaOptions(Pattern.compile(regex), maxGenerationDepth, maxInstantiationDepth);
  }

  public SchemaOptions withMaxGenerationDepth(int depth) {
    return new SchemaOptions(excludedPropertyPattern, depth, maxInstantiationDepth);
  }

  public SchemaOptions withMaxInstantiationDepth(int depth) {
    return new SchemaOptions(excludedPropertyPattern, maxGenerationDepth, depth);
  }

  boolean excludes(String propertyName) {
    return excludedPropertyPattern.matcher(propertyName).matches();
  }

  String summary() {
    return "exclude=" + excludedPropertyPattern.pattern()
        + " maxGenerationDepth=" + maxGenerationDepth
        + " maxInstantiationDepth=" + maxInstantiationDepth;
  }

  private static int intProperty(String name, int fallback) {
    String raw = System.getProperty(name);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
    }
  }
}

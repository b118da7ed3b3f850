package io.github.simbo1905.json.classschema;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// Mutable state of one generation run: the shared definitions table, the set
/// of classes currently being generated and the nesting depth.
final class GenerationContext {
  private final ReflectionHost host;
  private final SchemaOptions options;
  private final TreeMap<String, Definition> defs = new TreeMap<>();
  private final Set<String> inProgress = new LinkedHashSet<>();
  private final Set<String> recursive = new LinkedHashSet<>();
  private int depth;

  GenerationContext(ReflectionHost host, SchemaOptions options) {
    this.host = Objects.requireNonNull(host, "host");
    this.options = Objects.requireNonNull(options, "options");
  }

  ReflectionHost host() {
    return host;
  }

  SchemaOptions options() {
    return options;
  }

  /// Insert or overwrite a definition under its canonical name
  void register(String name, Definition definition) {
    Definition previous = defs.put(name, definition);
    if (previous == null) {
      StructuredLog.finer(LOG, "defs.register", "name", name, "kind", definition.getClass().getSimpleName());
    }
  }

  boolean isDefined(String name) {
    return defs.containsKey(name);
  }

  boolean isInProgress(String name) {
    return inProgress.contains(name);
  }

  /// Record that a class was reached again from inside its own graph
  void markRecursive(String name) {
    if (recursive.add(name)) {
      StructuredLog.finer(LOG, "class.cycle", "name", name, "path", inProgress);
    }
  }

  boolean isRecursive(String name) {
    return recursive.contains(name);
  }

  void enter(String name) {
    depth++;
    if (depth > options.maxGenerationDepth()) {
      int reached = depth;
      depth--;
      StructuredLog.error(LOG, "class.depth", "name", name, "depth", reached, "max", options.maxGenerationDepth());
      throw new ResolutionException(ResolutionException.Reason.DEPTH_EXCEEDED,
          "Class nesting deeper than " + options.maxGenerationDepth() + " at " + name);
    }
    inProgress.add(name);
  }

  void exit(String name) {
    inProgress.remove(name);
    depth--;
  }

  Map<String, Definition> defs() {
    return Collections.unmodifiableMap(defs);
  }

  /// Snapshot of the table for a [RootSchema]
  SortedMap<String, Definition> snapshot() {
    return new TreeMap<>(defs);
  }

  /// Remove an entry, returning it
  Definition take(String name) {
    return defs.remove(name);
  }
}

package io.github.simbo1905.json.classschema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// Keyed store of compiled class schemas.
///
/// Writes are serialized on the library monitor; reads go straight to the
/// backing concurrent map. A failed generation leaves the store unchanged.
///
/// ```java
/// SchemaLibrary library = new SchemaLibrary(host);
/// CompiledClassSchema person = library.generateNamed("Person");
/// Object instance = library.instantiate(ClassSource.named("Person"), "{\"name\":\"John Doe\",\"age\":43}");
/// ```
public final class SchemaLibrary {

  private final SchemaHost host;
  private final SchemaOptions options;
  private final ConcurrentHashMap<ClassSource, CompiledClassSchema> schemas = new ConcurrentHashMap<>();
  private final List<CompiledClassSchema> typeInfoSchemas = new ArrayList<>();

  public SchemaLibrary(SchemaHost host, SchemaOptions options) {
    this.host = Objects.requireNonNull(host, "host");
    this.options = Objects.requireNonNull(options, "options");
  }

  public SchemaLibrary(SchemaHost host) {
    this(host, SchemaOptions.DEFAULT);
  }

  /// Generate, compile and store the schema of a class, replacing any earlier entry
  public synchronized CompiledClassSchema generate(ClassSource source) {
    Objects.requireNonNull(source, "source");
    StructuredLog.fine(LOG, "library.generate", "class", source.definitionName());
    CompiledClassSchema compiled = CompiledClassSchema.compile(RootSchema.generate(source, host, options), options);
    schemas.put(source, compiled);
    return compiled;
  }

  /// Generate for a class looked up by its global name
  ///
  /// @throws ResolutionException with `CLASS_NOT_FOUND` when the host does not know the name
  public CompiledClassSchema generateNamed(String className) {
    Objects.requireNonNull(className, "className");
    ClassSource source = host.findClass(className).orElseThrow(() -> {
      StructuredLog.error(LOG, "library.generate", "class", className, "reason", "not found");
      return new ResolutionException(ResolutionException.Reason.CLASS_NOT_FOUND, "Class not found: " + className);
    });
    return generate(source);
  }

  public CompiledClassSchema generateUnnamed(String location) {
    return generate(ClassSource.unnamed(location));
  }

  /// Schema for a single property type. Kept aside rather than keyed.
  public synchronized CompiledClassSchema generateTypeInfo(PropertyDescriptor descriptor) {
    CompiledClassSchema compiled = CompiledClassSchema.compile(RootSchema.fromTypeInfo(descriptor, host, options), options);
    typeInfoSchemas.add(compiled);
    return compiled;
  }

  /// Compile and store an externally built schema
  public synchronized CompiledClassSchema insert(ClassSource source, RootSchema schema) {
    Objects.requireNonNull(source, "source");
    CompiledClassSchema compiled = CompiledClassSchema.compile(schema, options);
    schemas.put(source, compiled);
    StructuredLog.fine(LOG, "library.insert", "class", source.definitionName());
    return compiled;
  }

  public Optional<CompiledClassSchema> get(ClassSource source) {
    return Optional.ofNullable(schemas.get(source));
  }

  public Optional<CompiledClassSchema> getNamed(String className) {
    return get(ClassSource.named(className));
  }

  public Optional<CompiledClassSchema> getUnnamed(String location) {
    return get(ClassSource.unnamed(location));
  }

  /// Snapshot of the keyed schemas
  public Map<ClassSource, CompiledClassSchema> schemas() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
  }

  /// Snapshot of the schemas made by [#generateTypeInfo]
  public synchronized List<CompiledClassSchema> typeInfoSchemas() {
    return List.copyOf(typeInfoSchemas);
  }

  /// Drop every schema made by [#generateTypeInfo]
  public synchronized void clearTypeInfoSchemas() {
    typeInfoSchemas.clear();
  }

  public Optional<CompiledClassSchema> remove(ClassSource source) {
    return Optional.ofNullable(schemas.remove(source));
  }

  /// Validate and instantiate JSON against a class schema, generating the schema first when it is not stored
  public Object instantiate(ClassSource source, String json) {
    CompiledClassSchema compiled = get(source).orElseGet(() -> generate(source));
    return compiled.instantiate(json, host);
  }
}

package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// A base definition plus the definitions table its references point into.
///
/// This is the unit of generation, caching and instantiation. It is immutable:
/// [#withDefinition] and [#withClass] return new instances.
///
/// ```java
/// RootSchema schema = RootSchema.generate(ClassSource.named("Person"), host, SchemaOptions.DEFAULT);
/// String text = schema.toJsonPretty();
/// ```
public record RootSchema(SortedMap<String, Definition> defs, Definition base) {

  public static final String DRAFT_2020_12 = "https://json-schema.org/draft/2020-12/schema";

  /// Property name of the synthetic wrapper around a base that is not object-shaped
  public static final String VALUE_PROPERTY = "value";

  public RootSchema {
    Objects.requireNonNull(defs, "defs");
    Objects.requireNonNull(base, "base");
    defs = Collections.unmodifiableSortedMap(new TreeMap<>(defs));
  }

  public RootSchema(Definition base) {
    this(new TreeMap<>(), base);
  }

  /// Generate the schema of a class
  ///
  /// @throws ResolutionException when a property type cannot be resolved
  /// @throws HostException when the host fails to reflect
  public static RootSchema generate(ClassSource source, ReflectionHost host, SchemaOptions options) {
    Objects.requireNonNull(source, "source");
    LOG.fine(() -> "generate: start class=" + source.definitionName() + " options=" + options.summary());
    GenerationContext context = new GenerationContext(host, options);
    JClass base = ClassGenerator.generate(source, context);
    if (context.isRecursive(base.name())) {
      context.register(base.name(), base);
    }
    RootSchema result = new RootSchema(context.snapshot(), base);
    LOG.fine(() -> "generate: done class=" + source.definitionName() + " defs=" + result.defs().keySet());
    return result;
  }

  public static RootSchema generate(ClassSource source, ReflectionHost host) {
    return generate(source, host, SchemaOptions.DEFAULT);
  }

  /// Schema for the type of a single property rather than a whole class.
  ///
  /// A composite becomes its own source definition and a referenced class or
  /// enum is lifted out of the defs table to become the base.
  public static RootSchema fromTypeInfo(PropertyDescriptor descriptor, ReflectionHost host, SchemaOptions options) {
    Objects.requireNonNull(descriptor, "descriptor");
    GenerationContext context = new GenerationContext(host, options);
    Type type = TypeResolver.resolve(descriptor, context);
    Definition base;
    if (type instanceof JRef ref) {
      base = context.isRecursive(ref.name()) ? ref.resolve(context.defs()) : context.take(ref.name());
      if (base == null) {
        throw new DanglingReferenceException(ref.name());
      }
    } else if (type instanceof JBuiltin builtin) {
      base = builtin.type().sourceDefinition();
    } else {
      base = (Definition) type;
    }
    StructuredLog.fine(LOG, "typeinfo.generated", "property", descriptor.name(), "base", base.getClass().getSimpleName());
    return new RootSchema(context.snapshot(), base);
  }

  /// Copy with one more (or one replaced) definition
  public RootSchema withDefinition(String name, Definition definition) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(definition, "definition");
    TreeMap<String, Definition> copy = new TreeMap<>(defs);
    copy.put(name, definition);
    return new RootSchema(copy, base);
  }

  /// Copy with a class added under its canonical name
  public RootSchema withClass(JClass jclass) {
    return withDefinition(jclass.name(), jclass);
  }

  /// Whether the emitted document wraps the base under [#VALUE_PROPERTY]
  public boolean wrapsValue() {
    return !base.isObjectShaped();
  }

  /// The emitted draft 2020-12 document
  public ObjectNode toJsonNode() {
    SchemaWriter writer = SchemaWriter.INSTANCE;
    ObjectNode root = JsonSupport.MAPPER.createObjectNode();
    if (base.description() != null) {
      root.put("description", base.description());
    }
    root.put("$schema", DRAFT_2020_12);

    ObjectNode defsNode = root.putObject("$defs");
    defs.forEach((name, definition) -> defsNode.set(name, writer.write(definition)));
    BuiltinClosure.of(this).forEach((name, definition) -> defsNode.set(name, writer.write(definition)));

    ObjectNode body = wrapsValue()
        ? writer.write(new JObject(Map.of(VALUE_PROPERTY, base.withDescription(null))))
        : writer.write(base);
    Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!"description".equals(field.getKey())) {
        root.set(field.getKey(), field.getValue());
      }
    }
    return root;
  }

  public String toJsonCompact() {
    try {
      return JsonSupport.MAPPER.writeValueAsString(toJsonNode());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Schema tree could not be written", e);
    }
  }

  public String toJsonPretty() {
    try {
      return JsonSupport.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonNode());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Schema tree could not be written", e);
    }
  }

  /// Convert a JSON value shaped like the base (not the `value` wrapper) into a native value
  ///
  /// @throws ConversionException when the value does not fit
  public Object instantiate(JsonNode value, ObjectFactory factory, SchemaOptions options) {
    return new Instantiator(defs, factory, options).instantiate(value, base);
  }

  public Object instantiate(JsonNode value, ObjectFactory factory) {
    return instantiate(value, factory, SchemaOptions.DEFAULT);
  }
}

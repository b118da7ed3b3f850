package io.github.simbo1905.json.classschema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// Builds a [JClass] from a host's reflective property list
final class ClassGenerator {

  private ClassGenerator() {}

  /// Generate the class itself. Nested classes end up in the context's defs table.
  static JClass generate(ClassSource source, GenerationContext context) {
    String name = source.definitionName();
    context.enter(name);
    try {
      StructuredLog.fine(LOG, "class.generate", "name", name);
      List<PropertyDescriptor> descriptors = propertyList(source, context.host());
      Map<String, Type> properties = new LinkedHashMap<>();
      for (PropertyDescriptor descriptor : descriptors) {
        if (skip(descriptor, context.options())) {
          StructuredLog.finest(LOG, "property.skip", "class", name, "property", descriptor.name());
          continue;
        }
        properties.put(descriptor.name(), describe(source, descriptor, TypeResolver.resolve(descriptor, context), context));
      }
      String description = context.host().description(source).orElse(null);
      StructuredLog.fine(LOG, "class.generated", "name", name, "properties", properties.size());
      return new JClass(source, properties, description);
    } finally {
      context.exit(name);
    }
  }

  /// Reference to a class, generating and registering it on first sight.
  /// A class that is already being generated further up is referenced without recursing.
  static JRef reference(ClassSource source, GenerationContext context) {
    String name = source.definitionName();
    if (context.isInProgress(name)) {
      context.markRecursive(name);
      return new JRef(name);
    }
    if (!context.isDefined(name)) {
      context.register(name, generate(source, context));
    }
    return new JRef(name);
  }

  private static Type describe(ClassSource source, PropertyDescriptor descriptor, Type type, GenerationContext context) {
    if (type instanceof Definition definition) {
      Optional<String> description = context.host().propertyDescription(source, descriptor.name());
      if (description.isPresent()) {
        return definition.withDescription(description.get());
      }
    }
    return type;
  }

  private static boolean skip(PropertyDescriptor descriptor, SchemaOptions options) {
    if (options.excludes(descriptor.name())) {
      return true;
    }
    for (PropertyUsage usage : descriptor.usage()) {
      if (PropertyUsage.GROUPING.contains(usage)) {
        return true;
      }
    }
    return false;
  }

  private static List<PropertyDescriptor> propertyList(ClassSource source, ReflectionHost host) {
    try {
      return host.propertyList(source);
    } catch (ClassSchemaException e) {
      throw e;
    } catch (RuntimeException e) {
      StructuredLog.error(LOG, "host.properties", "class", source.definitionName(), "cause", e);
      throw new HostException("Host could not list properties of " + source.definitionName(), e);
    }
  }
}

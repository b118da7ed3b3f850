package io.github.simbo1905.json.classschema;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Predicate;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// Turns one reflective property descriptor into a schema [Type].
///
/// The rules are tried in order and the first that applies decides. Classes
/// and enums are registered in the context's defs table and come back as
/// [JRef]; everything else is inlined.
final class TypeResolver {

  private record Rule(String name, Predicate<PropertyDescriptor> applies,
                      BiFunction<PropertyDescriptor, GenerationContext, Type> resolver) {
  }

  private static final List<Rule> RULES = List.of(
      new Rule("enum",
          d -> d.kind() == ValueKind.INT && d.hasUsage(PropertyUsage.CLASS_IS_ENUM),
          (d, ctx) -> enumPath(d.className(), ctx)),
      new Rule("object",
          d -> d.kind() == ValueKind.OBJECT,
          TypeResolver::object),
      new Rule("typed-array",
          d -> d.kind() == ValueKind.ARRAY && d.hint() == PropertyHint.ARRAY_TYPE,
          (d, ctx) -> new JArray(hint(d.hintString(), ctx))),
      new Rule("untyped-array",
          d -> d.kind() == ValueKind.ARRAY,
          (d, ctx) -> JArray.untyped()),
      new Rule("raw-kind",
          d -> true,
          (d, ctx) -> rawKind(d))
  );

  private TypeResolver() {}

  static Type resolve(PropertyDescriptor descriptor, GenerationContext context) {
    for (Rule rule : RULES) {
      if (rule.applies().test(descriptor)) {
        StructuredLog.finer(LOG, "resolve", "property", descriptor.name(), "rule", rule.name(), "kind", descriptor.kind());
        return rule.resolver().apply(descriptor, context);
      }
    }
    throw new IllegalStateException("no rule for " + descriptor);
  }

  /// Property type for an object reference. A blank or unknown class name falls back to the hint payload.
  private static Type object(PropertyDescriptor descriptor, GenerationContext context) {
    String className = descriptor.className();
    if (!className.isBlank()) {
      Optional<ClassSource> source = context.host().findClass(className);
      if (source.isPresent()) {
        return ClassGenerator.reference(source.get(), context);
      }
      if (descriptor.hintString().isBlank()) {
        throw failure(ResolutionException.Reason.CLASS_NOT_FOUND,
            "Class '" + className + "' of property '" + descriptor.name() + "' is not known to the host");
      }
    }
    return hint(descriptor.hintString(), context);
  }

  /// Element type from a hint payload such as `int`, `Vector3`, `Fact` or `Person.Gender`
  static Type hint(String payload, GenerationContext context) {
    if (payload.isEmpty()) {
      return new JNull();
    }
    Optional<Definition> spelled = spelling(payload);
    if (spelled.isPresent()) {
      return spelled.get();
    }
    Optional<ClassSource> source = context.host().findClass(payload);
    if (source.isPresent()) {
      return ClassGenerator.reference(source.get(), context);
    }
    if (payload.indexOf('.') >= 0) {
      return enumPath(payload, context);
    }
    throw failure(ResolutionException.Reason.UNSUPPORTED_HINT, "Unsupported type hint: '" + payload + "'");
  }

  /// Known host type names
  static Optional<Definition> spelling(String name) {
    switch (name) {
      case "int":
        return Optional.of(new JInteger());
      case "float":
        return Optional.of(new JNumber());
      case "bool":
        return Optional.of(new JBoolean());
      case "String":
      case "StringName":
      case "NodePath":
        return Optional.of(new JString());
      case "Dictionary":
        return Optional.of(JObject.dictionary());
      case "Array":
        return Optional.of(JArray.untyped());
      default:
        return BuiltinType.bySchemaName(name).map(JBuiltin::new);
    }
  }

  /// Register the enum named by a `Class.Enum` path and reference it
  static JRef enumPath(String path, GenerationContext context) {
    String[] segments = path.split("\\.", -1);
    if (segments.length != 2 || segments[0].isBlank() || segments[1].isBlank()) {
      throw failure(ResolutionException.Reason.ENUM_PATH_MALFORMED,
          "Enum path must be 'Class.Enum': '" + path + "'");
    }
    ClassSource owner = context.host().findClass(segments[0]).orElseThrow(() -> failure(
        ResolutionException.Reason.CLASS_NOT_FOUND,
        "Class '" + segments[0] + "' of enum path '" + path + "' is not known to the host"));
    Map<String, Long> variants = context.host().enumVariants(owner, segments[1]);
    if (variants == null || variants.isEmpty()) {
      throw failure(ResolutionException.Reason.ENUM_NOT_FOUND,
          "Enum '" + segments[1] + "' not found on class '" + segments[0] + "'");
    }
    context.register(path, new JEnum(path, variants));
    return new JRef(path);
  }

  private static Definition rawKind(PropertyDescriptor descriptor) {
    ValueKind kind = descriptor.kind();
    switch (kind) {
      case BOOL:
        return new JBoolean();
      case INT:
        return new JInteger();
      case FLOAT:
        return new JNumber();
      case STRING:
      case STRING_NAME:
      case NODE_PATH:
        return new JString();
      case DICTIONARY:
        return JObject.dictionary();
      default:
        return kind.builtin()
            .<Definition>map(JBuiltin::new)
            .orElseThrow(() -> failure(ResolutionException.Reason.UNSUPPORTED_KIND,
                "Unsupported kind " + kind + " of property '" + descriptor.name() + "'"));
    }
  }

  private static ResolutionException failure(ResolutionException.Reason reason, String message) {
    StructuredLog.error(LOG, "resolve.failed", "reason", reason, "message", message);
    return new ResolutionException(reason, message);
  }
}

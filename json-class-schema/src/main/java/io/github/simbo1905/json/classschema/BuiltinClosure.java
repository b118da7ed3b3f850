package io.github.simbo1905.json.classschema;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// Transitive set of catalog composites reachable from a schema graph.
///
/// References are not followed: every referenced definition is already an
/// explicit defs entry and is walked as one.
public final class BuiltinClosure implements DefinitionVisitor<Set<BuiltinType>, Void> {

  private static final BuiltinClosure INSTANCE = new BuiltinClosure();

  private BuiltinClosure() {}

  /// Append every composite reachable from `type` to `accumulator`, in first-seen order
  public static void collect(Type type, Set<BuiltinType> accumulator) {
    if (type instanceof Definition definition) {
      definition.accept(INSTANCE, accumulator);
    }
  }

  /// Closure definitions to emit next to the explicit defs of `schema`.
  /// Names the explicit defs already hold are left out.
  public static Map<String, Definition> of(RootSchema schema) {
    Set<BuiltinType> reached = new LinkedHashSet<>();
    for (Definition explicit : schema.defs().values()) {
      collect(explicit, reached);
    }
    collect(schema.base(), reached);

    Map<String, Definition> result = new LinkedHashMap<>();
    for (BuiltinType type : reached) {
      if (!schema.defs().containsKey(type.schemaName())) {
        result.putIfAbsent(type.schemaName(), type.sourceDefinition());
      }
    }
    return result;
  }

  private static void add(BuiltinType type, Set<BuiltinType> accumulator) {
    if (accumulator.add(type)) {
      for (BuiltinType dependency : type.dependencies()) {
        add(dependency, accumulator);
      }
    }
  }

  @Override
  public Void visitNull(JNull def, Set<BuiltinType> acc) {
    return null;
  }

  @Override
  public Void visitBoolean(JBoolean def, Set<BuiltinType> acc) {
    return null;
  }

  @Override
  public Void visitInteger(JInteger def, Set<BuiltinType> acc) {
    return null;
  }

  @Override
  public Void visitNumber(JNumber def, Set<BuiltinType> acc) {
    return null;
  }

  @Override
  public Void visitString(JString def, Set<BuiltinType> acc) {
    return null;
  }

  @Override
  public Void visitObject(JObject def, Set<BuiltinType> acc) {
    def.properties().values().forEach(type -> collect(type, acc));
    return null;
  }

  @Override
  public Void visitArray(JArray def, Set<BuiltinType> acc) {
    def.itemType().ifPresent(type -> collect(type, acc));
    return null;
  }

  @Override
  public Void visitTuple(JTuple def, Set<BuiltinType> acc) {
    def.items().forEach(type -> collect(type, acc));
    return null;
  }

  @Override
  public Void visitEnum(JEnum def, Set<BuiltinType> acc) {
    return null;
  }

  @Override
  public Void visitClass(JClass def, Set<BuiltinType> acc) {
    def.properties().values().forEach(type -> collect(type, acc));
    return null;
  }

  @Override
  public Void visitBuiltin(JBuiltin def, Set<BuiltinType> acc) {
    add(def.type(), acc);
    return null;
  }
}

package io.github.simbo1905.json.classschema;

/// Exhaustive dispatch over [Definition] variants.
///
/// @param <A> per-call argument
/// @param <R> result
public interface DefinitionVisitor<A, R> {
  R visitNull(JNull def, A arg);

  R visitBoolean(JBoolean def, A arg);

  R visitInteger(JInteger def, A arg);

  R visitNumber(JNumber def, A arg);

  R visitString(JString def, A arg);

  R visitObject(JObject def, A arg);

  R visitArray(JArray def, A arg);

  R visitTuple(JTuple def, A arg);

  R visitEnum(JEnum def, A arg);

  R visitClass(JClass def, A arg);

  R visitBuiltin(JBuiltin def, A arg);
}

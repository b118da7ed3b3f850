package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/// Serializes IR nodes into draft 2020-12 keywords
final class SchemaWriter implements DefinitionVisitor<Void, ObjectNode> {

  static final SchemaWriter INSTANCE = new SchemaWriter();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private SchemaWriter() {}

  ObjectNode write(Type type) {
    if (type instanceof JRef ref) {
      ObjectNode node = NODES.objectNode();
      node.put("$ref", ref.pointer());
      return node;
    }
    return ((Definition) type).accept(this, null);
  }

  private static ObjectNode typed(String type) {
    ObjectNode node = NODES.objectNode();
    node.put("type", type);
    return node;
  }

  private static ObjectNode described(ObjectNode node, Definition def) {
    if (def.description() != null) {
      node.put("description", def.description());
    }
    return node;
  }

  private ObjectNode closedObject(Map<String, Type> properties) {
    ObjectNode node = typed("object");
    ObjectNode props = node.putObject("properties");
    ArrayNode required = node.putArray("required");
    properties.forEach((name, type) -> {
      props.set(name, write(type));
      required.add(name);
    });
    node.put("additionalProperties", false);
    return node;
  }

  @Override
  public ObjectNode visitNull(JNull def, Void arg) {
    return described(typed("null"), def);
  }

  @Override
  public ObjectNode visitBoolean(JBoolean def, Void arg) {
    return described(typed("boolean"), def);
  }

  @Override
  public ObjectNode visitInteger(JInteger def, Void arg) {
    return described(typed("integer"), def);
  }

  @Override
  public ObjectNode visitNumber(JNumber def, Void arg) {
    return described(typed("number"), def);
  }

  @Override
  public ObjectNode visitString(JString def, Void arg) {
    return described(typed("string"), def);
  }

  @Override
  public ObjectNode visitObject(JObject def, Void arg) {
    ObjectNode node = def.isDictionary() ? typed("object") : closedObject(def.properties());
    return described(node, def);
  }

  @Override
  public ObjectNode visitArray(JArray def, Void arg) {
    ObjectNode node = typed("array");
    def.itemType().ifPresent(items -> node.set("items", write(items)));
    return described(node, def);
  }

  @Override
  public ObjectNode visitTuple(JTuple def, Void arg) {
    ObjectNode node = typed("array");
    ArrayNode prefix = node.putArray("prefixItems");
    def.items().forEach(item -> prefix.add(write(item)));
    return described(node, def);
  }

  @Override
  public ObjectNode visitEnum(JEnum def, Void arg) {
    ObjectNode node = typed("string");
    ArrayNode names = node.putArray("enum");
    def.variants().keySet().forEach(names::add);
    return described(node, def);
  }

  @Override
  public ObjectNode visitClass(JClass def, Void arg) {
    return described(closedObject(def.properties()), def);
  }

  @Override
  public ObjectNode visitBuiltin(JBuiltin def, Void arg) {
    ObjectNode node = NODES.objectNode();
    node.put("$ref", JRef.pointerTo(def.type().schemaName()));
    return described(node, def);
  }
}

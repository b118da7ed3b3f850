package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// Converts a JSON value into a native value by walking it against a definition.
///
/// One instance serves one conversion: it tracks the JSON path for error
/// messages and the nesting depth.
final class Instantiator implements DefinitionVisitor<JsonNode, Object> {

  private final Map<String, Definition> defs;
  private final ObjectFactory factory;
  private final SchemaOptions options;
  private final Deque<String> path = new ArrayDeque<>();
  private int depth;

  Instantiator(Map<String, Definition> defs, ObjectFactory factory, SchemaOptions options) {
    this.defs = Objects.requireNonNull(defs, "defs");
    this.factory = Objects.requireNonNull(factory, "factory");
    this.options = Objects.requireNonNull(options, "options");
  }

  Object instantiate(JsonNode value, Type type) {
    Objects.requireNonNull(value, "value");
    depth++;
    try {
      if (depth > options.maxInstantiationDepth()) {
        throw failure(ConversionException.Reason.DEPTH_EXCEEDED,
            "Nesting deeper than " + options.maxInstantiationDepth());
      }
      Definition definition = type.resolve(defs);
      StructuredLog.finest(LOG, "instantiate", "path", path(), "definition", definition.getClass().getSimpleName());
      return definition.accept(this, value);
    } finally {
      depth--;
    }
  }

  /// Convert the value of an object property
  Object child(String key, JsonNode value, Type type) {
    path.addLast("." + key);
    try {
      return instantiate(value, type);
    } finally {
      path.removeLast();
    }
  }

  private Object element(int index, JsonNode value, Type type) {
    path.addLast("[" + index + "]");
    try {
      return instantiate(value, type);
    } finally {
      path.removeLast();
    }
  }

  String path() {
    StringBuilder sb = new StringBuilder("$");
    path.forEach(sb::append);
    return sb.toString();
  }

  ConversionException failure(ConversionException.Reason reason, String message) {
    String at = path();
    StructuredLog.error(LOG, "instantiate.failed", "reason", reason, "path", at, "message", message);
    return new ConversionException(reason, at, message);
  }

  ConversionException mismatch(String expected, JsonNode actual) {
    return failure(ConversionException.Reason.TYPE_MISMATCH,
        "Expected " + expected + ", got " + actual.getNodeType().name().toLowerCase());
  }

  Object construct(ClassSource source) {
    Object handle;
    try {
      handle = factory.construct(source);
    } catch (HostException e) {
      throw e;
    } catch (RuntimeException e) {
      StructuredLog.error(LOG, "host.construct", "class", source.definitionName(), "cause", e);
      throw new HostException("Host could not construct " + source.definitionName(), e);
    }
    if (handle == null) {
      StructuredLog.error(LOG, "host.construct", "class", source.definitionName(), "cause", "null handle");
      throw new HostException("Host returned no instance for " + source.definitionName());
    }
    return handle;
  }

  void assign(Object handle, String name, Object value) {
    try {
      factory.setProperty(handle, name, value);
    } catch (HostException e) {
      throw e;
    } catch (RuntimeException e) {
      StructuredLog.error(LOG, "host.assign", "property", name, "path", path(), "cause", e);
      throw new HostException("Host could not assign property '" + name + "' at " + path(), e);
    }
  }

  @Override
  public Object visitNull(JNull def, JsonNode value) {
    if (!value.isNull()) {
      throw mismatch("null", value);
    }
    return null;
  }

  @Override
  public Object visitBoolean(JBoolean def, JsonNode value) {
    if (!value.isBoolean()) {
      throw mismatch("boolean", value);
    }
    return value.booleanValue();
  }

  @Override
  public Object visitInteger(JInteger def, JsonNode value) {
    if (!value.isNumber()) {
      throw mismatch("integer", value);
    }
    if (!value.isIntegralNumber()) {
      throw failure(ConversionException.Reason.EXPECTED_INTEGER_GOT_FLOAT,
          "Expected integer, got float " + value.asText());
    }
    BigInteger integer = value.bigIntegerValue();
    if (!def.width().contains(integer)) {
      throw failure(ConversionException.Reason.INTEGER_OUT_OF_RANGE,
          "Integer " + integer + " outside " + def.width() + " range [" + def.width().min() + ", " + def.width().max() + "]");
    }
    return def.width().toNative(integer);
  }

  @Override
  public Object visitNumber(JNumber def, JsonNode value) {
    if (!value.isNumber()) {
      throw mismatch("number", value);
    }
    return def.width().narrow(value.doubleValue());
  }

  @Override
  public Object visitString(JString def, JsonNode value) {
    if (!value.isTextual()) {
      throw mismatch("string", value);
    }
    return value.textValue();
  }

  @Override
  public Object visitObject(JObject def, JsonNode value) {
    if (!value.isObject()) {
      throw mismatch("object", value);
    }
    if (def.isDictionary()) {
      return GenericValues.dictionary(value);
    }
    if (value.size() != def.properties().size()) {
      throw failure(ConversionException.Reason.PROPERTY_COUNT_MISMATCH,
          "Expected " + def.properties().size() + " properties, got " + value.size());
    }
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, Type> property : def.properties().entrySet()) {
      JsonNode propertyValue = value.get(property.getKey());
      if (propertyValue == null) {
        throw failure(ConversionException.Reason.MISSING_PROPERTY,
            "Missing property '" + property.getKey() + "'");
      }
      result.put(property.getKey(), child(property.getKey(), propertyValue, property.getValue()));
    }
    return result;
  }

  @Override
  public Object visitArray(JArray def, JsonNode value) {
    if (!value.isArray()) {
      throw mismatch("array", value);
    }
    if (def.items() == null) {
      List<Object> values = new ArrayList<>(value.size());
      for (int i = 0; i < value.size(); i++) {
        values.add(GenericValues.toNative(value.get(i)));
      }
      return GenericValues.array(values);
    }
    ElementType elementType = def.items().resolve(defs).accept(ElementTypes.INSTANCE, null);
    List<Object> values = new ArrayList<>(value.size());
    for (int i = 0; i < value.size(); i++) {
      values.add(element(i, value.get(i), def.items()));
    }
    return new TypedArray(elementType, values);
  }

  @Override
  public Object visitTuple(JTuple def, JsonNode value) {
    if (!value.isArray()) {
      throw mismatch("array", value);
    }
    if (value.size() != def.items().size()) {
      throw failure(ConversionException.Reason.TUPLE_ARITY_MISMATCH,
          "Expected " + def.items().size() + " elements, got " + value.size());
    }
    List<Object> values = new ArrayList<>(value.size());
    for (int i = 0; i < value.size(); i++) {
      values.add(element(i, value.get(i), def.items().get(i)));
    }
    return Collections.unmodifiableList(values);
  }

  @Override
  public Object visitEnum(JEnum def, JsonNode value) {
    if (!value.isTextual()) {
      throw mismatch("enum name", value);
    }
    Long variant = def.variants().get(value.textValue());
    if (variant == null) {
      throw failure(ConversionException.Reason.UNKNOWN_VARIANT,
          "Expected one of " + String.join(", ", def.variants().keySet()) + ", got '" + value.textValue() + "'");
    }
    return variant;
  }

  @Override
  public Object visitClass(JClass def, JsonNode value) {
    return def.instantiateWith(this, value);
  }

  @Override
  public Object visitBuiltin(JBuiltin def, JsonNode value) {
    Object payload = instantiate(value, def.type().sourceDefinition());
    return new CompositeValue(def.type(), payload);
  }

  /// Element type of a typed array, derived from its item definition
  static final class ElementTypes implements DefinitionVisitor<Void, ElementType> {
    static final ElementTypes INSTANCE = new ElementTypes();

    private ElementTypes() {}

    @Override
    public ElementType visitNull(JNull def, Void arg) {
      return ElementType.of(ValueKind.NIL);
    }

    @Override
    public ElementType visitBoolean(JBoolean def, Void arg) {
      return ElementType.of(ValueKind.BOOL);
    }

    @Override
    public ElementType visitInteger(JInteger def, Void arg) {
      return ElementType.of(ValueKind.INT);
    }

    @Override
    public ElementType visitNumber(JNumber def, Void arg) {
      return ElementType.of(ValueKind.FLOAT);
    }

    @Override
    public ElementType visitString(JString def, Void arg) {
      return ElementType.of(ValueKind.STRING);
    }

    @Override
    public ElementType visitObject(JObject def, Void arg) {
      return ElementType.of(ValueKind.DICTIONARY);
    }

    @Override
    public ElementType visitArray(JArray def, Void arg) {
      return ElementType.of(ValueKind.ARRAY);
    }

    @Override
    public ElementType visitTuple(JTuple def, Void arg) {
      return ElementType.of(ValueKind.ARRAY);
    }

    @Override
    public ElementType visitEnum(JEnum def, Void arg) {
      return ElementType.of(ValueKind.INT);
    }

    @Override
    public ElementType visitClass(JClass def, Void arg) {
      return new ElementType(ValueKind.OBJECT, def.name());
    }

    @Override
    public ElementType visitBuiltin(JBuiltin def, Void arg) {
      return ElementType.of(def.type().kind());
    }
  }
}

package io.github.simbo1905.json.classschema.validator;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.simbo1905.json.classschema.validator.SchemaLogging.LOG;

/// Compiles a parsed schema document into the immutable [JsonSchema] tree.
///
/// Every compiled node is indexed by its JSON Pointer so that local `$ref`
/// values can be resolved lazily at validation time. Targets are compiled on
/// first sight; a target that is still being compiled further up the stack is
/// left to the lazy lookup, which is what makes recursive definitions work.
final class SchemaCompiler {

  private SchemaCompiler() {}

  /// Per-compilation session state (no static mutable fields).
  private static final class Session {
    final JsonNode rawRoot;
    final JsonSchema.JsonSchemaOptions options;
    final Map<String, JsonSchema> pointerIndex = new LinkedHashMap<>();
    final Map<String, String> anchors = new LinkedHashMap<>();
    final Deque<String> resolutionStack = new ArrayDeque<>();
    final JsonSchema.ResolverContext resolverContext;
    JsonSchema currentRootSchema;

    Session(JsonNode rawRoot, JsonSchema.JsonSchemaOptions options) {
      this.rawRoot = rawRoot;
      this.options = options;
      this.resolverContext = new JsonSchema.ResolverContext(pointerIndex,
          () -> currentRootSchema != null ? currentRootSchema : AnySchema.INSTANCE);
    }
  }

  static JsonSchema compile(JsonNode schemaJson, JsonSchema.JsonSchemaOptions options) {
    Session session = new Session(schemaJson, options);
    collectAnchors(session, schemaJson, JsonSchema.SCHEMA_POINTER_ROOT);
    JsonSchema root = compileAt(session, JsonSchema.SCHEMA_POINTER_ROOT, schemaJson);
    session.currentRootSchema = root;
    LOG.finer(() -> "SchemaCompiler.compile: indexed pointers=" + session.pointerIndex.size() + " anchors=" + session.anchors.size());
    return root;
  }

  /// Escape one reference token per RFC 6901
  static String escapePointerToken(String token) {
    return token.replace("~", "~0").replace("/", "~1");
  }

  static String unescapePointerToken(String token) {
    return token.replace("~1", "/").replace("~0", "~");
  }

  /// Navigate a local JSON Pointer (with or without the leading `#`) within a raw document
  static Optional<JsonNode> navigatePointer(JsonNode root, String pointer) {
    String path = pointer.startsWith(JsonSchema.SCHEMA_POINTER_ROOT) ? pointer.substring(1) : pointer;
    if (path.isEmpty()) {
      return Optional.of(root);
    }
    if (!path.startsWith("/")) {
      return Optional.empty();
    }
    JsonNode current = root;
    for (String rawToken : path.substring(1).split("/", -1)) {
      String token = unescapePointerToken(rawToken);
      if (current.isObject()) {
        current = current.get(token);
      } else if (current.isArray()) {
        try {
          current = current.get(Integer.parseInt(token));
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      } else {
        return Optional.empty();
      }
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  /// Classify a `$ref` string; only same-document references are supported
  static JsonSchema.RefToken classifyRef(String ref) {
    if (!ref.startsWith(JsonSchema.SCHEMA_POINTER_ROOT)) {
      LOG.severe(() -> "ERROR: SCHEMA: remote $ref not supported ref=" + ref);
      throw new IllegalArgumentException("Remote $ref not supported: " + ref);
    }
    return new JsonSchema.RefToken(ref);
  }

  private static void collectAnchors(Session session, JsonNode node, String pointer) {
    if (node.isObject()) {
      JsonNode anchor = node.get("$anchor");
      if (anchor != null && anchor.isTextual()) {
        session.anchors.put(JsonSchema.SCHEMA_POINTER_ROOT + anchor.asText(), pointer);
      }
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        // const and enum payloads are data, not subschemas
        if (field.getKey().equals("const") || field.getKey().equals("enum")) {
          continue;
        }
        collectAnchors(session, field.getValue(), pointer + "/" + escapePointerToken(field.getKey()));
      }
    } else if (node.isArray()) {
      for (int i = 0; i < node.size(); i++) {
        collectAnchors(session, node.get(i), pointer + "/" + i);
      }
    }
  }

  private static JsonSchema compileAt(Session session, String pointer, JsonNode node) {
    JsonSchema cached = session.pointerIndex.get(pointer);
    if (cached != null) {
      return cached;
    }
    session.resolutionStack.push(pointer);
    try {
      JsonSchema compiled = compileNode(session, node, pointer);
      session.pointerIndex.put(pointer, compiled);
      LOG.finest(() -> "compileAt: " + pointer + " -> " + compiled.getClass().getSimpleName());
      return compiled;
    } finally {
      session.resolutionStack.pop();
    }
  }

  private static JsonSchema compileNode(Session session, JsonNode node, String pointer) {
    if (node.isBoolean()) {
      return node.booleanValue() ? AnySchema.INSTANCE : NotSchema.NOTHING;
    }
    if (!node.isObject()) {
      LOG.severe(() -> "ERROR: SCHEMA: not an object or boolean at " + pointer);
      throw new IllegalArgumentException("Schema must be an object or boolean at " + pointer);
    }

    // Definitions first so references below can find them in the index
    JsonNode defs = node.get("$defs");
    if (defs != null && defs.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> entries = defs.fields();
      while (entries.hasNext()) {
        Map.Entry<String, JsonNode> entry = entries.next();
        compileAt(session, pointer + "/$defs/" + escapePointerToken(entry.getKey()), entry.getValue());
      }
    }

    JsonNode refValue = node.get("$ref");
    if (refValue != null && refValue.isTextual()) {
      return compileRef(session, refValue.asText());
    }

    List<JsonSchema> parts = new ArrayList<>();

    JsonSchema typed = compileTyped(session, node, pointer);

    JsonNode enumValue = node.get("enum");
    if (enumValue != null) {
      if (!enumValue.isArray()) {
        throw new IllegalArgumentException("enum must be an array at " + pointer);
      }
      List<JsonNode> allowed = new ArrayList<>();
      enumValue.forEach(allowed::add);
      parts.add(new EnumSchema(typed != null ? typed : AnySchema.INSTANCE, allowed));
    } else if (typed != null) {
      parts.add(typed);
    }

    JsonNode constValue = node.get("const");
    if (constValue != null) {
      parts.add(new ConstSchema(constValue));
    }

    JsonNode allOf = node.get("allOf");
    if (allOf != null) {
      parts.add(new AllOfSchema(compileList(session, allOf, pointer + "/allOf")));
    }
    JsonNode anyOf = node.get("anyOf");
    if (anyOf != null) {
      parts.add(new AnyOfSchema(compileList(session, anyOf, pointer + "/anyOf")));
    }
    JsonNode oneOf = node.get("oneOf");
    if (oneOf != null) {
      parts.add(new OneOfSchema(compileList(session, oneOf, pointer + "/oneOf")));
    }
    JsonNode not = node.get("not");
    if (not != null) {
      parts.add(new NotSchema(compileAt(session, pointer + "/not", not)));
    }

    if (parts.isEmpty()) {
      return AnySchema.INSTANCE;
    }
    return parts.size() == 1 ? parts.get(0) : new AllOfSchema(List.copyOf(parts));
  }

  private static JsonSchema compileRef(Session session, String ref) {
    LOG.finer(() -> "compileRef: " + ref);
    JsonSchema.RefToken token = classifyRef(ref);
    if (ref.equals(JsonSchema.SCHEMA_POINTER_ROOT)) {
      return new RootRef(() -> session.resolverContext.resolve(token));
    }
    String target = ref;
    if (!ref.startsWith(JsonSchema.SCHEMA_POINTER_PREFIX)) {
      target = session.anchors.get(ref);
      if (target == null) {
        LOG.severe(() -> "ERROR: SCHEMA: unresolved anchor ref=" + ref);
        throw new IllegalArgumentException("Unresolved $ref: " + ref);
      }
    }
    if (!session.pointerIndex.containsKey(target) && !session.resolutionStack.contains(target)) {
      final String pointer = target;
      JsonNode raw = navigatePointer(session.rawRoot, pointer).orElseThrow(() -> {
        LOG.severe(() -> "ERROR: SCHEMA: unresolved pointer ref=" + ref);
        return new IllegalArgumentException("Unresolved $ref: " + ref);
      });
      compileAt(session, pointer, raw);
    }
    if (!target.equals(ref)) {
      // anchor: resolve through the pointer it names
      return new RefSchema(new JsonSchema.RefToken(target), session.resolverContext);
    }
    return new RefSchema(token, session.resolverContext);
  }

  private static List<JsonSchema> compileList(Session session, JsonNode array, String pointer) {
    if (!array.isArray() || array.isEmpty()) {
      throw new IllegalArgumentException("Expected non-empty array of schemas at " + pointer);
    }
    List<JsonSchema> schemas = new ArrayList<>();
    for (int i = 0; i < array.size(); i++) {
      schemas.add(compileAt(session, pointer + "/" + i, array.get(i)));
    }
    return List.copyOf(schemas);
  }

  private static JsonSchema compileTyped(Session session, JsonNode obj, String pointer) {
    JsonNode typeValue = obj.get("type");
    if (typeValue != null && typeValue.isTextual()) {
      return compileForType(session, obj, pointer, typeValue.asText(), true);
    }
    if (typeValue != null && typeValue.isArray()) {
      List<JsonSchema> typeSchemas = new ArrayList<>();
      for (JsonNode item : typeValue) {
        if (!item.isTextual()) {
          throw new IllegalArgumentException("Type array must contain only strings");
        }
        typeSchemas.add(compileForType(session, obj, pointer, item.asText(), true));
      }
      if (typeSchemas.isEmpty()) {
        return AnySchema.INSTANCE;
      }
      return typeSchemas.size() == 1 ? typeSchemas.get(0) : new AnyOfSchema(List.copyOf(typeSchemas));
    }
    if (typeValue != null) {
      throw new IllegalArgumentException("type must be a string or array at " + pointer);
    }

    // Keyword-only schemas constrain matching instances and let other types through
    List<JsonSchema> implied = new ArrayList<>();
    if (hasAny(obj, "properties", "required", "additionalProperties", "minProperties", "maxProperties", "patternProperties")) {
      implied.add(compileObject(session, obj, pointer, false));
    }
    if (hasAny(obj, "items", "prefixItems", "minItems", "maxItems", "uniqueItems")) {
      implied.add(compileArray(session, obj, pointer, false));
    }
    if (hasAny(obj, "pattern", "minLength", "maxLength")) {
      implied.add(compileString(session, obj, false));
    }
    if (hasAny(obj, "minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf")) {
      implied.add(compileNumber(obj, false, false));
    }
    if (implied.isEmpty()) {
      return null;
    }
    return implied.size() == 1 ? implied.get(0) : new AllOfSchema(List.copyOf(implied));
  }

  private static JsonSchema compileForType(Session session, JsonNode obj, String pointer, String type, boolean typeAsserted) {
    switch (type) {
      case "object":
        return compileObject(session, obj, pointer, typeAsserted);
      case "array":
        return compileArray(session, obj, pointer, typeAsserted);
      case "string":
        return compileString(session, obj, typeAsserted);
      case "number":
        return compileNumber(obj, false, typeAsserted);
      case "integer":
        return compileNumber(obj, true, typeAsserted);
      case "boolean":
        return new BooleanSchema();
      case "null":
        return new NullSchema();
      default:
        LOG.severe(() -> "ERROR: SCHEMA: unknown type '" + type + "' at " + pointer);
        throw new IllegalArgumentException("Unknown type: " + type);
    }
  }

  private static boolean hasAny(JsonNode obj, String... keys) {
    for (String key : keys) {
      if (obj.has(key)) {
        return true;
      }
    }
    return false;
  }

  private static JsonSchema compileObject(Session session, JsonNode obj, String pointer, boolean typeAsserted) {
    Map<String, JsonSchema> properties = new LinkedHashMap<>();
    JsonNode propsValue = obj.get("properties");
    if (propsValue != null && propsValue.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> entries = propsValue.fields();
      while (entries.hasNext()) {
        Map.Entry<String, JsonNode> entry = entries.next();
        String propPointer = pointer + JsonSchema.SCHEMA_PROPERTIES_SEGMENT + escapePointerToken(entry.getKey());
        properties.put(entry.getKey(), compileAt(session, propPointer, entry.getValue()));
      }
    }

    Set<String> required = new LinkedHashSet<>();
    JsonNode reqValue = obj.get("required");
    if (reqValue != null) {
      if (!reqValue.isArray()) {
        throw new IllegalArgumentException("required must be an array at " + pointer);
      }
      for (JsonNode item : reqValue) {
        if (!item.isTextual()) {
          throw new IllegalArgumentException("required entries must be strings at " + pointer);
        }
        required.add(item.asText());
      }
    }

    JsonSchema additionalProperties = null;
    JsonNode addPropsValue = obj.get("additionalProperties");
    if (addPropsValue != null) {
      additionalProperties = compileAt(session, pointer + "/additionalProperties", addPropsValue);
    }

    Map<Pattern, JsonSchema> patternProperties = null;
    JsonNode patternPropsValue = obj.get("patternProperties");
    if (patternPropsValue != null && patternPropsValue.isObject()) {
      patternProperties = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> entries = patternPropsValue.fields();
      while (entries.hasNext()) {
        Map.Entry<String, JsonNode> entry = entries.next();
        Pattern pattern = compilePattern(session, entry.getKey());
        String patternPointer = pointer + "/patternProperties/" + escapePointerToken(entry.getKey());
        patternProperties.put(pattern, compileAt(session, patternPointer, entry.getValue()));
      }
    }

    return new ObjectSchema(
        properties,
        required,
        additionalProperties,
        getInteger(obj, "minProperties"),
        getInteger(obj, "maxProperties"),
        patternProperties,
        typeAsserted);
  }

  private static JsonSchema compileArray(Session session, JsonNode obj, String pointer, boolean typeAsserted) {
    JsonSchema items = null;
    JsonNode itemsValue = obj.get("items");
    if (itemsValue != null) {
      items = compileAt(session, pointer + "/items", itemsValue);
    }

    List<JsonSchema> prefixItems = null;
    JsonNode prefixValue = obj.get("prefixItems");
    if (prefixValue != null) {
      prefixItems = compileList(session, prefixValue, pointer + "/prefixItems");
    }

    return new ArraySchema(
        items,
        prefixItems,
        getInteger(obj, "minItems"),
        getInteger(obj, "maxItems"),
        getBoolean(obj, "uniqueItems"),
        typeAsserted);
  }

  private static JsonSchema compileString(Session session, JsonNode obj, boolean typeAsserted) {
    Pattern pattern = null;
    JsonNode patternValue = obj.get("pattern");
    if (patternValue != null) {
      if (!patternValue.isTextual()) {
        throw new IllegalArgumentException("pattern must be a string");
      }
      pattern = compilePattern(session, patternValue.asText());
    }
    return new StringSchema(getInteger(obj, "minLength"), getInteger(obj, "maxLength"), pattern, typeAsserted);
  }

  private static JsonSchema compileNumber(JsonNode obj, boolean integer, boolean typeAsserted) {
    return new NumberSchema(
        getBigDecimal(obj, "minimum"),
        getBigDecimal(obj, "maximum"),
        getBigDecimal(obj, "exclusiveMinimum"),
        getBigDecimal(obj, "exclusiveMaximum"),
        getBigDecimal(obj, "multipleOf"),
        integer,
        typeAsserted);
  }

  private static Pattern compilePattern(Session session, String regex) {
    if (regex.length() > session.options.maxPatternLength()) {
      throw new IllegalArgumentException("Pattern exceeds maxPatternLength=" + session.options.maxPatternLength());
    }
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      LOG.severe(() -> "ERROR: SCHEMA: invalid pattern " + regex);
      throw new IllegalArgumentException("Invalid pattern: " + regex, e);
    }
  }

  private static Integer getInteger(JsonNode obj, String key) {
    JsonNode value = obj.get(key);
    if (value == null) {
      return null;
    }
    if (!value.isNumber() || !NumberSchema.isIntegral(value.decimalValue()) || value.decimalValue().signum() < 0) {
      throw new IllegalArgumentException(key + " must be a non-negative integer");
    }
    return value.decimalValue().intValueExact();
  }

  private static Boolean getBoolean(JsonNode obj, String key) {
    JsonNode value = obj.get(key);
    if (value == null) {
      return null;
    }
    if (!value.isBoolean()) {
      throw new IllegalArgumentException(key + " must be a boolean");
    }
    return value.booleanValue();
  }

  private static BigDecimal getBigDecimal(JsonNode obj, String key) {
    JsonNode value = obj.get(key);
    if (value == null) {
      return null;
    }
    if (!value.isNumber()) {
      throw new IllegalArgumentException(key + " must be a number");
    }
    return value.decimalValue();
  }
}

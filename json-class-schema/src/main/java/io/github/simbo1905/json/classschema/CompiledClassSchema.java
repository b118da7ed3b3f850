package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.simbo1905.json.classschema.validator.JsonSchema;

import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;

import static io.github.simbo1905.json.classschema.ClassSchemaLogging.LOG;

/// A [RootSchema] together with its emitted document and the validator compiled from it.
///
/// Immutable and safe to share between threads.
public final class CompiledClassSchema {

  private static final Pattern RESPONSE_FORMAT_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

  private final RootSchema root;
  private final SchemaOptions options;
  private final ObjectNode document;
  private final String json;
  private final JsonSchema validator;

  private CompiledClassSchema(RootSchema root, SchemaOptions options, ObjectNode document, String json, JsonSchema validator) {
    this.root = root;
    this.options = options;
    this.document = document;
    this.json = json;
    this.validator = validator;
  }

  /// Emit and compile a schema
  ///
  /// @throws SchemaCompilationException when the validation engine rejects the document
  public static CompiledClassSchema compile(RootSchema root, SchemaOptions options) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(options, "options");
    ObjectNode document = root.toJsonNode();
    JsonSchema validator;
    try {
      validator = JsonSchema.compile(document);
    } catch (IllegalArgumentException e) {
      StructuredLog.error(LOG, "schema.compile", "cause", e.getMessage());
      throw new SchemaCompilationException("Generated schema was rejected: " + e.getMessage(), e);
    }
    String json = root.toJsonPretty();
    LOG.finer(() -> "compiled schema: " + json);
    return new CompiledClassSchema(root, options, document, json, validator);
  }

  public static CompiledClassSchema compile(RootSchema root) {
    return compile(root, SchemaOptions.DEFAULT);
  }

  public RootSchema root() {
    return root;
  }

  /// Copy of the emitted document
  public ObjectNode document() {
    return document.deepCopy();
  }

  /// Pretty-printed document text
  public String json() {
    return json;
  }

  public JsonSchema.ValidationResult validate(JsonNode value) {
    return validator.validate(value);
  }

  /// Parse, validate and convert a JSON document into a native value
  ///
  /// @throws ConversionException with `MALFORMED_JSON` when the text does not parse
  /// @throws SchemaValidationException when the document does not match the schema
  public Object instantiate(String jsonText, ObjectFactory factory) {
    Objects.requireNonNull(jsonText, "jsonText");
    JsonNode value;
    try {
      value = JsonSupport.MAPPER.readTree(jsonText);
    } catch (JsonProcessingException e) {
      StructuredLog.error(LOG, "instantiate.parse", "cause", e.getOriginalMessage());
      throw new ConversionException(ConversionException.Reason.MALFORMED_JSON, "$",
          "Malformed JSON: " + e.getOriginalMessage(), e);
    }
    if (value == null || value.isMissingNode()) {
      throw new ConversionException(ConversionException.Reason.MALFORMED_JSON, "$", "Malformed JSON: no content");
    }
    return instantiate(value, factory);
  }

  /// Validate and convert a parsed document
  ///
  /// @throws SchemaValidationException when the document does not match the schema
  public Object instantiate(JsonNode value, ObjectFactory factory) {
    Objects.requireNonNull(value, "value");
    JsonSchema.ValidationResult result = validator.validate(value);
    if (!result.valid()) {
      StructuredLog.error(LOG, "instantiate.invalid", "errors", result.errors());
      throw new SchemaValidationException(result.errors());
    }
    JsonNode payload = root.wrapsValue() ? value.get(RootSchema.VALUE_PROPERTY) : value;
    return root.instantiate(payload, factory, options);
  }

  /// Structured output request payload `{"type":"json_schema","json_schema":{...}}`
  public String openAiResponseFormat(String name) {
    Objects.requireNonNull(name, "name");
    if (!RESPONSE_FORMAT_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Response format name must match " + RESPONSE_FORMAT_NAME.pattern() + ": " + name);
    }
    ObjectNode format = JsonSupport.MAPPER.createObjectNode();
    format.put("type", "json_schema");
    ObjectNode inner = format.putObject("json_schema");
    inner.put("name", name);
    inner.set("schema", document.deepCopy());
    try {
      return JsonSupport.MAPPER.writeValueAsString(format);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Response format could not be written", e);
    }
  }

  /// Schema for a JSON array of this schema's base. The base moves into the defs under `itemName`.
  public CompiledClassSchema arraySchema(String itemName) {
    Objects.requireNonNull(itemName, "itemName");
    if (itemName.isBlank()) {
      throw new IllegalArgumentException("itemName must not be blank");
    }
    TreeMap<String, Definition> defs = new TreeMap<>(root.defs());
    defs.put(itemName, root.base());
    return compile(new RootSchema(defs, new JArray(new JRef(itemName))), options);
  }

  @Override
  public String toString() {
    return "CompiledClassSchema[" + root.base().getClass().getSimpleName() + ", defs=" + root.defs().keySet() + "]";
  }
}

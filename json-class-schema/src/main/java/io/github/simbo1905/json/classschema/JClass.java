package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A reflected class: its identity plus its ordered, typed property map.
///
/// Serializes like a closed [JObject] but always emits `properties`,
/// `required` and `additionalProperties:false`, even with no properties.
public record JClass(ClassSource source, Map<String, Type> properties, String description) implements Definition {
  public JClass {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(properties, "properties");
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public JClass(ClassSource source, Map<String, Type> properties) {
    this(source, properties, null);
  }

  /// Canonical definitions-table name
  public String name() {
    return source.definitionName();
  }

  @Override
  public JClass withDescription(String description) {
    return new JClass(source, properties, description);
  }

  @Override
  public boolean isObjectShaped() {
    return true;
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitClass(this, arg);
  }

  /// Build a native instance of this class from a JSON object of property values.
  ///
  /// @param defs definitions that property references resolve against
  /// @param propertyValues JSON object whose keys are exactly the declared properties
  /// @param factory host construction capability
  /// @return the host handle
  /// @throws ConversionException on an unknown or missing property or a bad value
  /// @throws HostException when the host cannot construct or assign
  public Object instantiate(Map<String, Definition> defs, JsonNode propertyValues, ObjectFactory factory) {
    return instantiate(defs, propertyValues, factory, SchemaOptions.DEFAULT);
  }

  /// As [#instantiate(Map, JsonNode, ObjectFactory)] bounded by `options.maxInstantiationDepth()`
  public Object instantiate(Map<String, Definition> defs, JsonNode propertyValues, ObjectFactory factory,
                            SchemaOptions options) {
    Objects.requireNonNull(options, "options");
    return new Instantiator(defs, factory, options).instantiate(propertyValues, this);
  }

  Object instantiateWith(Instantiator instantiator, JsonNode propertyValues) {
    if (!propertyValues.isObject()) {
      throw instantiator.mismatch("object for class " + name(), propertyValues);
    }
    Iterator<String> keys = propertyValues.fieldNames();
    while (keys.hasNext()) {
      String key = keys.next();
      if (!properties.containsKey(key)) {
        throw instantiator.failure(ConversionException.Reason.UNKNOWN_PROPERTY,
            "Unknown property '" + key + "' for class " + name());
      }
    }
    for (String declared : properties.keySet()) {
      if (!propertyValues.has(declared)) {
        throw instantiator.failure(ConversionException.Reason.MISSING_PROPERTY,
            "Missing property '" + declared + "' for class " + name());
      }
    }

    Object handle = instantiator.construct(source);
    Iterator<Map.Entry<String, JsonNode>> fields = propertyValues.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      Object value = instantiator.child(field.getKey(), field.getValue(), properties.get(field.getKey()));
      instantiator.assign(handle, field.getKey(), value);
    }
    return handle;
  }
}

package io.github.simbo1905.json.classschema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Structural object. With no declared properties it is an open dictionary;
/// otherwise every property is required and no others are allowed.
public record JObject(Map<String, Type> properties, String description) implements Definition {
  public JObject {
    Objects.requireNonNull(properties, "properties");
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  public JObject(Map<String, Type> properties) {
    this(properties, null);
  }

  /// Open dictionary with arbitrary keys and values
  public static JObject dictionary() {
    return new JObject(Map.of(), null);
  }

  public boolean isDictionary() {
    return properties.isEmpty();
  }

  @Override
  public JObject withDescription(String description) {
    return new JObject(properties, description);
  }

  @Override
  public boolean isObjectShaped() {
    return true;
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitObject(this, arg);
  }

  /// Insertion-ordered builder
  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<String, Type> properties = new LinkedHashMap<>();
    private String description;

    private Builder() {}

    public Builder property(String name, Type type) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      properties.put(name, type);
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public JObject build() {
      return new JObject(properties, description);
    }
  }
}

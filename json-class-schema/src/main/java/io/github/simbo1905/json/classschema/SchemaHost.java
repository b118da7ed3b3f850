package io.github.simbo1905.json.classschema;

/// A host that can both describe and build its classes
public interface SchemaHost extends ReflectionHost, ObjectFactory {
}

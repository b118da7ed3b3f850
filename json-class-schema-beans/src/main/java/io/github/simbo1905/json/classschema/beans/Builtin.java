package io.github.simbo1905.json.classschema.beans;

import io.github.simbo1905.json.classschema.BuiltinType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Catalog type of a `CompositeValue` field, or of the elements of a collection of them
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Builtin {
  BuiltinType value();
}

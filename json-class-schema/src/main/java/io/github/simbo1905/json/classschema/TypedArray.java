package io.github.simbo1905.json.classschema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Homogeneously typed sequence produced for typed arrays
public record TypedArray(ElementType elementType, List<Object> values) {
  public TypedArray {
    Objects.requireNonNull(elementType, "elementType");
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }
}

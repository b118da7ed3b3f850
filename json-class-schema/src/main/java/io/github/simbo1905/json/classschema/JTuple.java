package io.github.simbo1905.json.classschema;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Fixed-length array with one type per position
public record JTuple(List<Type> items, String description) implements Definition {
  public JTuple {
    Objects.requireNonNull(items, "items");
    items = List.copyOf(items);
  }

  public JTuple(List<Type> items) {
    this(items, null);
  }

  /// `count` positions of the same type
  public static JTuple repeat(Type item, int count) {
    return new JTuple(Collections.nCopies(count, item), null);
  }

  @Override
  public JTuple withDescription(String description) {
    return new JTuple(items, description);
  }

  @Override
  public <A, R> R accept(DefinitionVisitor<A, R> visitor, A arg) {
    return visitor.visitTuple(this, arg);
  }
}

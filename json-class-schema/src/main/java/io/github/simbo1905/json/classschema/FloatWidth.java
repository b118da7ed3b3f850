package io.github.simbo1905.json.classschema;

public enum FloatWidth {
  FLOAT32,
  FLOAT64;

  double narrow(double value) {
    return this == FLOAT32 ? (double) (float) value : value;
  }
}

package io.github.simbo1905.json.classschema;

import java.math.BigInteger;

/// Valid range of an integer slot. Native integers are `Long`; see [#toNative].
public enum IntegerWidth {
  INT32(BigInteger.valueOf(Integer.MIN_VALUE), BigInteger.valueOf(Integer.MAX_VALUE)),
  INT64(BigInteger.valueOf(Long.MIN_VALUE), BigInteger.valueOf(Long.MAX_VALUE)),
  UINT8(BigInteger.ZERO, BigInteger.valueOf(255)),
  UINT64(BigInteger.ZERO, BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE)),
  /// Either a signed or an unsigned 64-bit value
  ANY64(BigInteger.valueOf(Long.MIN_VALUE), BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE));

  private final BigInteger min;
  private final BigInteger max;

  IntegerWidth(BigInteger min, BigInteger max) {
    this.min = min;
    this.max = max;
  }

  public BigInteger min() {
    return min;
  }

  public BigInteger max() {
    return max;
  }

  public boolean contains(BigInteger value) {
    return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
  }

  /// Native form of an in-range value.
  ///
  /// `UINT64` keeps the unsigned bit pattern in a `Long` (read it back with
  /// `Long.toUnsignedString`). `ANY64` returns a `BigInteger` for values above
  /// `Long.MAX_VALUE`.
  Object toNative(BigInteger value) {
    if (this == ANY64 && value.bitLength() > 63) {
      return value;
    }
    return value.longValue();
  }
}

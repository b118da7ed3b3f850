package io.github.simbo1905.json.classschema;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/// Shared Jackson mapper. Fractional numbers are read as `BigDecimal` so they
/// keep their exact value for the strict conversions. Anything after the first
/// value is a parse error.
final class JsonSupport {
  static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();

  private JsonSupport() {}
}

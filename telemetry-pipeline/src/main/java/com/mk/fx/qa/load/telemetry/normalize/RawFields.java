package com.mk.fx.qa.load.telemetry.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Lenient readers over raw JSON payloads. Missing or non-numeric values never raise; callers
 * decide what the fallback is.
 */
final class RawFields {

  private RawFields() {
    // Utility class, no instantiation
  }

  static boolean present(JsonNode node, String field) {
    JsonNode value = node == null ? null : node.get(field);
    return value != null && !value.isNull() && !value.isMissingNode();
  }

  /** Numeric value of the field, parsing numeric text; anything else is 0. */
  static double number(JsonNode node, String field) {
    return optionalNumber(node, field).orElse(0.0);
  }

  static OptionalDouble optionalNumber(JsonNode node, String field) {
    if (!present(node, field)) {
      return OptionalDouble.empty();
    }
    JsonNode value = node.get(field);
    if (value.isNumber()) {
      return finite(value.doubleValue());
    }
    if (value.isTextual()) {
      try {
        return finite(Double.parseDouble(value.textValue().trim()));
      } catch (NumberFormatException ex) {
        return OptionalDouble.of(0.0);
      }
    }
    return OptionalDouble.of(0.0);
  }

  /** First present field among the aliases, in order. */
  static OptionalDouble firstNumber(JsonNode node, String... fields) {
    for (String field : fields) {
      var value = optionalNumber(node, field);
      if (value.isPresent()) {
        return value;
      }
    }
    return OptionalDouble.empty();
  }

  static Optional<Boolean> bool(JsonNode node, String field) {
    if (!present(node, field)) {
      return Optional.empty();
    }
    JsonNode value = node.get(field);
    if (value.isBoolean()) {
      return Optional.of(value.booleanValue());
    }
    if (value.isTextual()) {
      var text = value.textValue().trim();
      if (text.equalsIgnoreCase("true")) return Optional.of(true);
      if (text.equalsIgnoreCase("false")) return Optional.of(false);
      return Optional.empty();
    }
    if (value.isNumber()) {
      return Optional.of(value.doubleValue() != 0.0);
    }
    return Optional.empty();
  }

  static Optional<String> text(JsonNode node, String field) {
    if (!present(node, field)) {
      return Optional.empty();
    }
    JsonNode value = node.get(field);
    return value.isValueNode() ? Optional.of(value.asText()) : Optional.empty();
  }

  /** Epoch millis from a numeric value or ISO-8601 text. */
  static Optional<Long> epochMillis(JsonNode node, String field) {
    if (!present(node, field)) {
      return Optional.empty();
    }
    JsonNode value = node.get(field);
    if (value.isNumber()) {
      double v = value.doubleValue();
      return Double.isFinite(v) ? Optional.of((long) v) : Optional.empty();
    }
    if (value.isTextual()) {
      var text = value.textValue().trim();
      try {
        return Optional.of(Long.parseLong(text));
      } catch (NumberFormatException notNumeric) {
        try {
          return Optional.of(Instant.parse(text).toEpochMilli());
        } catch (DateTimeParseException notIso) {
          return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }

  private static OptionalDouble finite(double value) {
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.of(0.0);
  }
}

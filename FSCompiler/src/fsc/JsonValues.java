package fsc;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

/** Conversions shared by the catalog and project readers. */
final class JsonValues {
  static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonValues() {}

  /**
   * Converts a scalar to String, Long, Double or Boolean. Arrays and objects become plain lists and
   * maps, which no property type accepts. Null yields empty.
   */
  static Optional<Object> toValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return Optional.empty();
    if (node.isTextual()) return Optional.of(node.textValue());
    if (node.isBoolean()) return Optional.of(node.booleanValue());
    if (node.isIntegralNumber() && node.canConvertToLong()) return Optional.of(node.longValue());
    if (node.isNumber()) return Optional.of(node.doubleValue());
    return Optional.of(MAPPER.convertValue(node, Object.class));
  }

  /** A string array, or a single string treated as a one-element array. */
  static ImmutableList<String> toLines(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) return ImmutableList.of();
    if (node.isTextual()) return ImmutableList.of(node.textValue());
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (JsonNode line : node) lines.add(line.asText());
    return lines.build();
  }

  static Optional<String> text(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || node.isNull()) return Optional.empty();
    return Optional.of(node.asText());
  }
}

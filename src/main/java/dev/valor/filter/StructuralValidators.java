package dev.valor.filter;

import com.fasterxml.jackson.databind.JsonNode;
import dev.valor.schema.TaskType;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashSet;
import java.util.Set;

/**
 * Shape checks for literal values, one per filterable type. Coordinates follow GeoJSON nesting:
 * a position is {@code [x, y]}, a ring is a list of positions, a polygon is a list of rings.
 */
final class StructuralValidators {

  private StructuralValidators() {
    // utility class
  }

  static void bool(JsonNode node) {
    require(node.isBoolean(), "expected a boolean");
  }

  static void string(JsonNode node) {
    require(node.isTextual(), "expected a string");
  }

  static void integer(JsonNode node) {
    require(node.isIntegralNumber() && node.canConvertToLong(), "expected an integer");
  }

  static void number(JsonNode node) {
    require(node.isNumber(), "expected a number");
  }

  static void datetime(JsonNode node) {
    string(node);
    try {
      OffsetDateTime.parse(node.asText());
    } catch (DateTimeParseException e) {
      throw new MalformedFilterException("Invalid datetime '" + node.asText() + "'");
    }
  }

  static void date(JsonNode node) {
    string(node);
    try {
      LocalDate.parse(node.asText());
    } catch (DateTimeParseException e) {
      throw new MalformedFilterException("Invalid date '" + node.asText() + "'");
    }
  }

  static void time(JsonNode node) {
    string(node);
    try {
      LocalTime.parse(node.asText());
    } catch (DateTimeParseException e) {
      throw new MalformedFilterException("Invalid time '" + node.asText() + "'");
    }
  }

  static void taskType(JsonNode node) {
    string(node);
    require(TaskType.parseOrNull(node.asText()) != null, "unknown task type " + node);
  }

  static void label(JsonNode node) {
    require(
        node.isObject()
            && node.size() == 2
            && node.path("key").isTextual()
            && node.path("value").isTextual(),
        "expected an object with string 'key' and 'value'");
  }

  static void point(JsonNode node) {
    require(isPosition(node), "expected a position [x, y]");
  }

  static void multipoint(JsonNode node) {
    require(node.isArray() && node.size() > 0, "expected a non-empty list of positions");
    node.forEach(StructuralValidators::point);
  }

  static void linestring(JsonNode node) {
    require(node.isArray() && node.size() >= 2, "a linestring needs at least two positions");
    node.forEach(StructuralValidators::point);
  }

  static void multilinestring(JsonNode node) {
    require(node.isArray() && node.size() > 0, "expected a non-empty list of linestrings");
    node.forEach(StructuralValidators::linestring);
  }

  static void polygon(JsonNode node) {
    require(node.isArray() && node.size() > 0, "a polygon needs at least one ring");
    node.forEach(StructuralValidators::ring);
  }

  static void multipolygon(JsonNode node) {
    require(node.isArray() && node.size() > 0, "expected a non-empty list of polygons");
    node.forEach(StructuralValidators::polygon);
  }

  static void box(JsonNode node) {
    polygon(node);
    require(node.size() == 1, "a box has exactly one ring");
    JsonNode ring = node.get(0);
    require(ring.size() == 5, "a box ring has exactly five positions");
    Set<Double> xs = new HashSet<>();
    Set<Double> ys = new HashSet<>();
    Set<String> corners = new HashSet<>();
    boolean edgesAligned = true;
    for (int i = 0; i < 4; i++) {
      JsonNode position = ring.get(i);
      JsonNode next = ring.get(i + 1);
      xs.add(position.get(0).asDouble());
      ys.add(position.get(1).asDouble());
      corners.add(position.get(0).asDouble() + "," + position.get(1).asDouble());
      boolean sameX = position.get(0).asDouble() == next.get(0).asDouble();
      boolean sameY = position.get(1).asDouble() == next.get(1).asDouble();
      // each edge runs along exactly one axis
      edgesAligned &= sameX != sameY;
    }
    require(
        corners.size() == 4 && xs.size() == 2 && ys.size() == 2 && edgesAligned,
        "a box must be an axis-aligned rectangle");
  }

  /** Types that exist as symbols but have no literal form. */
  static void noLiteral(JsonNode node) {
    throw new MalformedFilterException("values of this type cannot be written as literals");
  }

  private static void ring(JsonNode node) {
    require(node.isArray() && node.size() >= 4, "a ring needs at least four positions");
    node.forEach(StructuralValidators::point);
    require(samePosition(node.get(0), node.get(node.size() - 1)), "a ring must be closed");
  }

  private static boolean samePosition(JsonNode a, JsonNode b) {
    return a.get(0).asDouble() == b.get(0).asDouble() && a.get(1).asDouble() == b.get(1).asDouble();
  }

  private static boolean isPosition(JsonNode node) {
    return node.isArray() && node.size() == 2 && node.get(0).isNumber() && node.get(1).isNumber();
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new MalformedFilterException("Malformed value: " + message);
    }
  }
}

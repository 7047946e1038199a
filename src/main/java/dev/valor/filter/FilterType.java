package dev.valor.filter;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Closed set of filterable datatypes. Each constant carries its operator categories and the
 * structural validator its literals must pass.
 */
public enum FilterType {
  BOOL("bool", Kind.SCALAR, StructuralValidators::bool, OperatorCategory.EQUATABLE),
  STRING("string", Kind.SCALAR, StructuralValidators::string, OperatorCategory.EQUATABLE),
  INTEGER(
      "integer",
      Kind.SCALAR,
      StructuralValidators::integer,
      OperatorCategory.EQUATABLE,
      OperatorCategory.QUANTIFIABLE),
  FLOAT(
      "float",
      Kind.SCALAR,
      StructuralValidators::number,
      OperatorCategory.EQUATABLE,
      OperatorCategory.QUANTIFIABLE),
  DATETIME(
      "datetime",
      Kind.SCALAR,
      StructuralValidators::datetime,
      OperatorCategory.EQUATABLE,
      OperatorCategory.QUANTIFIABLE),
  DATE(
      "date",
      Kind.SCALAR,
      StructuralValidators::date,
      OperatorCategory.EQUATABLE,
      OperatorCategory.QUANTIFIABLE),
  TIME(
      "time",
      Kind.SCALAR,
      StructuralValidators::time,
      OperatorCategory.EQUATABLE,
      OperatorCategory.QUANTIFIABLE),
  DURATION(
      "duration",
      Kind.SCALAR,
      StructuralValidators::number,
      OperatorCategory.EQUATABLE,
      OperatorCategory.QUANTIFIABLE),
  POINT(
      "point",
      Kind.GEOMETRY,
      StructuralValidators::point,
      OperatorCategory.EQUATABLE,
      OperatorCategory.SPATIAL),
  MULTIPOINT(
      "multipoint", Kind.GEOMETRY, StructuralValidators::multipoint, OperatorCategory.SPATIAL),
  LINESTRING(
      "linestring", Kind.GEOMETRY, StructuralValidators::linestring, OperatorCategory.SPATIAL),
  MULTILINESTRING(
      "multilinestring",
      Kind.GEOMETRY,
      StructuralValidators::multilinestring,
      OperatorCategory.SPATIAL),
  POLYGON("polygon", Kind.GEOMETRY, StructuralValidators::polygon, OperatorCategory.SPATIAL),
  BOX("box", Kind.GEOMETRY, StructuralValidators::box, OperatorCategory.SPATIAL),
  MULTIPOLYGON(
      "multipolygon", Kind.GEOMETRY, StructuralValidators::multipolygon, OperatorCategory.SPATIAL),
  RASTER("raster", Kind.RASTER, StructuralValidators::noLiteral, OperatorCategory.SPATIAL),
  TASK_TYPE(
      "tasktypeenum", Kind.SCALAR, StructuralValidators::taskType, OperatorCategory.EQUATABLE),
  LABEL("label", Kind.LABEL, StructuralValidators::label, OperatorCategory.EQUATABLE),
  EMBEDDING("embedding", Kind.OPAQUE, StructuralValidators::noLiteral),
  DICTIONARY("dictionary", Kind.OPAQUE, StructuralValidators::noLiteral);

  /** Storage family of a type, used when choosing casts and geometric functions. */
  public enum Kind {
    SCALAR,
    GEOMETRY,
    RASTER,
    LABEL,
    OPAQUE
  }

  private final String value;
  private final Kind kind;
  private final Consumer<JsonNode> validator;
  private final Set<OperatorCategory> categories;

  FilterType(
      String value, Kind kind, Consumer<JsonNode> validator, OperatorCategory... categories) {
    this.value = value;
    this.kind = kind;
    this.validator = validator;
    EnumSet<OperatorCategory> set = EnumSet.noneOf(OperatorCategory.class);
    Collections.addAll(set, categories);
    this.categories = Collections.unmodifiableSet(set);
  }

  @JsonValue
  public String value() {
    return value;
  }

  public Kind kind() {
    return kind;
  }

  public Set<OperatorCategory> categories() {
    return categories;
  }

  /** True for point/line/polygon families, whose literals travel as GeoJSON. */
  public boolean isGeometric() {
    return kind == Kind.GEOMETRY;
  }

  /** True for numeric types that can be compared against a derived area. */
  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  /**
   * Whether a value of this type can be read out of a JSON metadata dictionary.
   *
   * @return true for scalars and GeoJSON geometries
   */
  public boolean isMetadataReadable() {
    return kind == Kind.SCALAR && this != TASK_TYPE || kind == Kind.GEOMETRY;
  }

  /**
   * Runs this type's structural validator against a literal.
   *
   * @param literal the raw JSON literal
   * @throws MalformedFilterException if the literal has the wrong shape
   */
  public void validate(JsonNode literal) {
    validator.accept(literal);
  }

  /**
   * Resolves a wire type name (case-insensitive).
   *
   * @param value the type string from the filter document
   * @return the matching type
   * @throws MalformedFilterException if the type is not filterable
   */
  public static FilterType fromValue(String value) {
    for (FilterType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new MalformedFilterException("Type '" + value + "' is not a filterable type");
  }
}

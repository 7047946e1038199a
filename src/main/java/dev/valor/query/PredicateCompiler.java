package dev.valor.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.valor.filter.AttributeModifier;
import dev.valor.filter.Comparison;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.FilterType;
import dev.valor.filter.KeyAccessException;
import dev.valor.filter.MalformedFilterException;
import dev.valor.filter.NullCheck;
import dev.valor.filter.Operand;
import dev.valor.filter.OperatorCategory;
import dev.valor.filter.Symbol;
import dev.valor.filter.SymbolName;
import dev.valor.filter.TypeMismatchException;
import dev.valor.filter.UnsupportedOperatorException;
import dev.valor.filter.Value;
import dev.valor.schema.TaskType;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Compiles a single leaf comparison into a {@link PredicateSet}.
 *
 * <p>All type and operator checks happen here, before any SQL exists. Identifiers in the generated
 * SQL come only from the symbol registry; literals and metadata keys are always bound as named
 * parameters prefixed with the predicate set's name.
 */
public final class PredicateCompiler {

  private PredicateCompiler() {
    // utility class
  }

  /**
   * Compiles a leaf node ({@link Comparison} or {@link NullCheck}).
   *
   * @param leaf the leaf expression
   * @param name CTE name for the resulting predicate set; also prefixes its parameters
   * @return the compiled predicate set
   */
  public static PredicateSet compileLeaf(FilterExpression leaf, String name) {
    if (leaf instanceof Comparison comparison) {
      return compileLeaf(comparison.op(), comparison.lhs(), comparison.rhs(), name);
    }
    if (leaf instanceof NullCheck nullCheck) {
      return compileLeaf(nullCheck.op(), nullCheck.arg(), null, name);
    }
    throw new MalformedFilterException("Only comparisons and null checks compile to predicates");
  }

  /**
   * Compiles {@code op(symbol, rhs)}.
   *
   * @param op comparison or null-check operator
   * @param symbol left operand
   * @param rhs right operand, null for null checks
   * @param name CTE name for the resulting predicate set
   * @return the compiled predicate set
   * @throws TypeMismatchException if operand types disagree
   * @throws UnsupportedOperatorException if {@code op} is not allowed for the operand
   * @throws KeyAccessException if a key is used on an attribute that is not a dictionary
   */
  public static PredicateSet compileLeaf(
      FilterOperator op, Symbol symbol, @Nullable Operand rhs, String name) {
    Set<OperatorCategory> categories = effectiveCategories(symbol);
    if (op.arity() == FilterOperator.Arity.BINARY && rhs == null) {
      throw new MalformedFilterException("'" + op.value() + "' requires a right-hand operand");
    }
    if (op.arity() == FilterOperator.Arity.UNARY && rhs != null) {
      throw new MalformedFilterException("'" + op.value() + "' takes no right-hand operand");
    }
    if (op.arity() == FilterOperator.Arity.NARY || op == FilterOperator.NOT) {
      throw new MalformedFilterException("'" + op.value() + "' is not a comparison");
    }
    if (!OperatorCategory.operatorsOf(categories).contains(op)) {
      throw new UnsupportedOperatorException(
          "Operator '" + op.value() + "' is not supported for " + describe(symbol));
    }

    Binder binder = new Binder(name);
    String lhsSql = operandSql(symbol, binder);
    String predicate;
    if (rhs == null) {
      predicate = lhsSql + (op == FilterOperator.IS_NULL ? " IS NULL" : " IS NOT NULL");
    } else {
      predicate = comparisonSql(op, symbol, lhsSql, rhs, binder);
    }

    String table = symbol.name().owner().table();
    String sql = "SELECT " + table + ".id AS id FROM " + table + " WHERE " + predicate;
    return new PredicateSet(name, symbol.name().owner(), sql, binder.params);
  }

  /**
   * Categories that decide which operators a symbol accepts, after applying its key and modifier.
   */
  static Set<OperatorCategory> effectiveCategories(Symbol symbol) {
    SymbolName name = symbol.name();
    if (symbol.key() != null) {
      if (!name.supportsKey()) {
        throw new KeyAccessException(
            "Attribute '" + name.value() + "' is not a dictionary and cannot be keyed");
      }
      if (!symbol.dtype().isMetadataReadable()) {
        throw new TypeMismatchException(
            "Type '" + symbol.dtype().value() + "' cannot be read from metadata");
      }
    } else if (symbol.dtype() != name.columnType()) {
      throw new TypeMismatchException(
          "Attribute '"
              + name.value()
              + "' has type '"
              + name.columnType().value()
              + "', not '"
              + symbol.dtype().value()
              + "'");
    }

    AttributeModifier attribute = symbol.attribute();
    if (attribute != null) {
      if (!attribute.appliesTo(symbol.dtype())) {
        throw new UnsupportedOperatorException(
            "Attribute '" + attribute.value() + "' is not defined for " + describe(symbol));
      }
      return attribute.categories();
    }
    if (symbol.key() != null) {
      EnumSet<OperatorCategory> categories = EnumSet.of(OperatorCategory.NULLABLE);
      categories.addAll(symbol.dtype().categories());
      return categories;
    }
    return name.categories();
  }

  private static String comparisonSql(
      FilterOperator op, Symbol symbol, String lhsSql, Operand rhs, Binder binder) {
    AttributeModifier attribute = symbol.attribute();
    FilterType dtype = symbol.dtype();

    if (rhs instanceof Symbol other) {
      if (other.name().owner() != symbol.name().owner()) {
        throw new MalformedFilterException(
            "Symbols '"
                + symbol.name().value()
                + "' and '"
                + other.name().value()
                + "' belong to different entities");
      }
      if (other.dtype() != dtype || other.attribute() != attribute) {
        throw new TypeMismatchException(
            "Cannot compare " + describe(symbol) + " with " + describe(other));
      }
      effectiveCategories(other);
      if (dtype == FilterType.LABEL) {
        throw new UnsupportedOperatorException("Labels cannot be compared with other symbols");
      }
      return applyOperator(op, dtype, attribute != null, lhsSql, operandSql(other, binder));
    }

    Value value = (Value) rhs;
    if (attribute != null && value.type().isNumeric()) {
      return applyOperator(op, FilterType.FLOAT, true, lhsSql, binder.bind(scalar(value)));
    }
    if (value.type() != dtype) {
      throw new TypeMismatchException(
          "Cannot compare "
              + describe(symbol)
              + " with a value of type '"
              + value.type().value()
              + "'");
    }
    if (dtype == FilterType.LABEL) {
      String match =
          "(labels.key = "
              + binder.bind(value.value().get("key").asText())
              + " AND labels.value = "
              + binder.bind(value.value().get("value").asText())
              + ")";
      return op == FilterOperator.EQ ? match : "NOT " + match;
    }
    String rhsSql = literalSql(value, binder);
    if (attribute != null) {
      rhsSql = modifierSql(attribute, dtype, rhsSql);
    }
    return applyOperator(op, dtype, attribute != null, lhsSql, rhsSql);
  }

  private static String applyOperator(
      FilterOperator op, FilterType dtype, boolean derived, String lhs, String rhs) {
    boolean geometric = !derived && (dtype.isGeometric() || dtype == FilterType.RASTER);
    if (geometric) {
      // rasters have no literal form, so both sides are raster columns
      String left = dtype == FilterType.RASTER ? "ST_Polygon(" + lhs + ")" : lhs;
      String right = dtype == FilterType.RASTER ? "ST_Polygon(" + rhs + ")" : rhs;
      if (op == FilterOperator.EQ) {
        return "ST_Equals(" + left + ", " + right + ")";
      }
      if (op == FilterOperator.NE) {
        return "NOT ST_Equals(" + left + ", " + right + ")";
      }
      if (op == FilterOperator.INTERSECTS) {
        return "ST_Intersects(" + left + ", " + right + ")";
      }
      if (op == FilterOperator.INSIDE) {
        return "ST_Covers(" + right + ", " + left + ")";
      }
      if (op == FilterOperator.OUTSIDE) {
        return "NOT ST_Covers(" + right + ", " + left + ")";
      }
      if (op == FilterOperator.CONTAINS) {
        return "ST_Covers(" + left + ", " + right + ")";
      }
    }
    String symbol = comparisonSymbol(op);
    if (symbol == null) {
      throw new UnsupportedOperatorException(
          "Operator '" + op.value() + "' is not supported for type '" + dtype.value() + "'");
    }
    return lhs + " " + symbol + " " + rhs;
  }

  private static @Nullable String comparisonSymbol(FilterOperator op) {
    if (op == FilterOperator.EQ) {
      return "=";
    }
    if (op == FilterOperator.NE) {
      return "<>";
    }
    if (op == FilterOperator.GT) {
      return ">";
    }
    if (op == FilterOperator.GE) {
      return ">=";
    }
    if (op == FilterOperator.LT) {
      return "<";
    }
    if (op == FilterOperator.LE) {
      return "<=";
    }
    return null;
  }

  /** SQL expression reading the symbol's value, with key access and modifier applied. */
  private static String operandSql(Symbol symbol, Binder binder) {
    SymbolName name = symbol.name();
    String column = name.qualifiedColumn();
    String expression;
    if (symbol.key() != null) {
      expression = metadataSql(column, binder.bind(symbol.key()), symbol.dtype());
    } else {
      expression = column;
    }
    if (symbol.attribute() != null) {
      return modifierSql(symbol.attribute(), symbol.dtype(), expression);
    }
    return expression;
  }

  private static String modifierSql(AttributeModifier attribute, FilterType dtype, String sql) {
    // area is the only modifier
    if (dtype == FilterType.RASTER) {
      return "ST_Count(" + sql + ")";
    }
    return "ST_Area(" + sql + ")";
  }

  /**
   * Typed read of {@code column -> key}. Yields NULL when the stored JSON has a different type or
   * does not parse as {@code dtype}; the {@code safe_*} functions come from the V3 migration.
   */
  private static String metadataSql(String column, String keyParam, FilterType dtype) {
    String raw = column + " -> " + keyParam;
    String text = column + " ->> " + keyParam;
    if (dtype == FilterType.INTEGER || dtype == FilterType.FLOAT) {
      return guarded(raw, "number", "safe_float8(" + text + ")");
    }
    if (dtype == FilterType.DURATION) {
      return guarded(raw, "number", "safe_duration(" + text + ")");
    }
    if (dtype == FilterType.BOOL) {
      return guarded(raw, "boolean", "CAST(" + text + " AS boolean)");
    }
    if (dtype == FilterType.STRING) {
      return guarded(raw, "string", text);
    }
    if (dtype == FilterType.DATETIME) {
      return guarded(raw, "string", "safe_timestamptz(" + text + ")");
    }
    if (dtype == FilterType.DATE) {
      return guarded(raw, "string", "safe_date(" + text + ")");
    }
    if (dtype == FilterType.TIME) {
      return guarded(raw, "string", "safe_time(" + text + ")");
    }
    if (dtype.isGeometric()) {
      return guarded(raw, "object", "safe_geometry(" + raw + ")");
    }
    throw new TypeMismatchException("Type '" + dtype.value() + "' cannot be read from metadata");
  }

  private static String guarded(String raw, String jsonType, String expression) {
    return "(CASE WHEN jsonb_typeof(" + raw + ") = '" + jsonType + "' THEN " + expression + " END)";
  }

  private static String literalSql(Value value, Binder binder) {
    FilterType type = value.type();
    if (type.isGeometric()) {
      return "ST_GeomFromGeoJSON(" + binder.bind(GeoJson.of(type, value.value())) + ")";
    }
    if (type == FilterType.DURATION) {
      return "make_interval(secs => " + binder.bind(value.value().asDouble()) + ")";
    }
    return binder.bind(scalar(value));
  }

  /** Java bind value for a scalar literal. */
  static Object scalar(Value value) {
    JsonNode node = value.value();
    FilterType type = value.type();
    if (type == FilterType.BOOL) {
      return node.asBoolean();
    }
    if (type == FilterType.INTEGER) {
      return node.asLong();
    }
    if (type == FilterType.FLOAT || type == FilterType.DURATION) {
      return node.asDouble();
    }
    if (type == FilterType.DATETIME) {
      return OffsetDateTime.parse(node.asText());
    }
    if (type == FilterType.DATE) {
      return LocalDate.parse(node.asText());
    }
    if (type == FilterType.TIME) {
      return LocalTime.parse(node.asText());
    }
    if (type == FilterType.STRING) {
      return node.asText();
    }
    if (type == FilterType.TASK_TYPE) {
      return TaskType.fromValue(node.asText()).value();
    }
    throw new TypeMismatchException("Type '" + type.value() + "' has no scalar form");
  }

  private static String describe(Symbol symbol) {
    StringBuilder sb = new StringBuilder("'").append(symbol.name().value());
    if (symbol.key() != null) {
      sb.append('[').append(symbol.key()).append(']');
    }
    if (symbol.attribute() != null) {
      sb.append('.').append(symbol.attribute().value());
    }
    return sb.append("' (").append(symbol.dtype().value()).append(')').toString();
  }

  /** Hands out parameter names {@code <prefix>_0, <prefix>_1, ...} and records their values. */
  private static final class Binder {

    private final String prefix;
    private final Map<String, Object> params = new LinkedHashMap<>();

    Binder(String prefix) {
      this.prefix = prefix;
    }

    String bind(Object value) {
      String name = prefix + "_" + params.size();
      params.put(name, value);
      return ":" + name;
    }
  }

  /** GeoJSON rendering of geometry literals, as accepted by {@code ST_GeomFromGeoJSON}. */
  static final class GeoJson {

    private GeoJson() {}

    static String of(FilterType type, JsonNode coordinates) {
      ObjectNode node = JsonNodeFactory.instance.objectNode();
      node.put("type", geoJsonType(type));
      node.set("coordinates", coordinates.deepCopy());
      return node.toString();
    }

    private static String geoJsonType(FilterType type) {
      if (type == FilterType.POINT) {
        return "Point";
      }
      if (type == FilterType.MULTIPOINT) {
        return "MultiPoint";
      }
      if (type == FilterType.LINESTRING) {
        return "LineString";
      }
      if (type == FilterType.MULTILINESTRING) {
        return "MultiLineString";
      }
      if (type == FilterType.POLYGON || type == FilterType.BOX) {
        return "Polygon";
      }
      if (type == FilterType.MULTIPOLYGON) {
        return "MultiPolygon";
      }
      throw new TypeMismatchException("Type '" + type.value() + "' is not a geometry");
    }
  }
}

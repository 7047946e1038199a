package dev.valor.filter;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/**
 * Every operator accepted in a filter expression, tagged with its arity and, for comparisons, the
 * category that grants it.
 */
public enum FilterOperator {
  NOT("not", Arity.UNARY, null),
  IS_NULL("isnull", Arity.UNARY, OperatorCategory.NULLABLE),
  IS_NOT_NULL("isnotnull", Arity.UNARY, OperatorCategory.NULLABLE),
  EQ("eq", Arity.BINARY, OperatorCategory.EQUATABLE),
  NE("ne", Arity.BINARY, OperatorCategory.EQUATABLE),
  GT("gt", Arity.BINARY, OperatorCategory.QUANTIFIABLE),
  GE("ge", Arity.BINARY, OperatorCategory.QUANTIFIABLE),
  LT("lt", Arity.BINARY, OperatorCategory.QUANTIFIABLE),
  LE("le", Arity.BINARY, OperatorCategory.QUANTIFIABLE),
  INTERSECTS("intersects", Arity.BINARY, OperatorCategory.SPATIAL),
  INSIDE("inside", Arity.BINARY, OperatorCategory.SPATIAL),
  OUTSIDE("outside", Arity.BINARY, OperatorCategory.SPATIAL),
  CONTAINS("contains", Arity.BINARY, OperatorCategory.SPATIAL),
  AND("and", Arity.NARY, null),
  OR("or", Arity.NARY, null),
  XOR("xor", Arity.NARY, null);

  /** Number of operands an operator node takes. */
  public enum Arity {
    UNARY,
    BINARY,
    NARY
  }

  private final String value;
  private final Arity arity;
  private final @Nullable OperatorCategory category;

  FilterOperator(String value, Arity arity, @Nullable OperatorCategory category) {
    this.value = value;
    this.arity = arity;
    this.category = category;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public Arity arity() {
    return arity;
  }

  /** Category granting this operator, or null for the logical connectives. */
  public @Nullable OperatorCategory category() {
    return category;
  }

  /**
   * Resolves a wire operator name (case-insensitive).
   *
   * @param value the operator string from the filter document
   * @return the matching operator
   * @throws MalformedFilterException if no operator has this name
   */
  public static FilterOperator fromValue(String value) {
    for (FilterOperator op : values()) {
      if (op.value.equalsIgnoreCase(value)) {
        return op;
      }
    }
    throw new MalformedFilterException("Operator '" + value + "' is not supported");
  }
}

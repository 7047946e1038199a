package dev.valor.filter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Capability groups that decide which operators an operand type accepts. */
public enum OperatorCategory {
  NULLABLE,
  EQUATABLE,
  QUANTIFIABLE,
  SPATIAL;

  /**
   * Operators granted by this category.
   *
   * @return an unmodifiable set of the comparison operators belonging to this category
   */
  public Set<FilterOperator> operators() {
    EnumSet<FilterOperator> result = EnumSet.noneOf(FilterOperator.class);
    for (FilterOperator op : FilterOperator.values()) {
      if (op.category() == this) {
        result.add(op);
      }
    }
    return Collections.unmodifiableSet(result);
  }

  /**
   * Union of the operators granted by every category in {@code categories}.
   *
   * @param categories the capability set of an operand
   * @return the operators allowed for that operand
   */
  public static Set<FilterOperator> operatorsOf(Set<OperatorCategory> categories) {
    EnumSet<FilterOperator> result = EnumSet.noneOf(FilterOperator.class);
    for (OperatorCategory category : categories) {
      result.addAll(category.operators());
    }
    return result;
  }
}

package dev.valor.filter;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Node of a parsed filter tree. Implementations: {@link Comparison}, {@link NullCheck}, {@link
 * Negation} and {@link Junction}.
 */
public interface FilterExpression {

  /** Canonical JSON form; {@link FilterParser#parse} of the result yields an equal tree. */
  ObjectNode toJson();

  /** True for the nodes that compile into a single predicate set. */
  default boolean isLeaf() {
    return false;
  }
}

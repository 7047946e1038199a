package dev.valor.filter;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Right-hand side of a comparison: either a literal {@link Value} or another {@link Symbol}. */
public interface Operand {

  /** Declared type of this operand. */
  FilterType type();

  ObjectNode toJson();
}

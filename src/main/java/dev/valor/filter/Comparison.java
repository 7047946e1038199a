package dev.valor.filter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Binary comparison between a symbol and a literal or a second symbol. */
public record Comparison(FilterOperator op, Symbol lhs, Operand rhs) implements FilterExpression {

  public Comparison {
    if (op == null || op.arity() != FilterOperator.Arity.BINARY) {
      throw new MalformedFilterException(
          "'" + (op == null ? null : op.value()) + "' is not a comparison operator");
    }
    if (lhs == null || rhs == null) {
      throw new MalformedFilterException("'" + op.value() + "' requires both 'lhs' and 'rhs'");
    }
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("op", op.value());
    node.set("lhs", lhs.toJson());
    node.set("rhs", rhs.toJson());
    return node;
  }
}

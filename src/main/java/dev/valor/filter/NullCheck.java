package dev.valor.filter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** {@code isnull} / {@code isnotnull} test on a single symbol. */
public record NullCheck(FilterOperator op, Symbol arg) implements FilterExpression {

  public NullCheck {
    if (op != FilterOperator.IS_NULL && op != FilterOperator.IS_NOT_NULL) {
      throw new MalformedFilterException(
          "'" + (op == null ? null : op.value()) + "' is not a null check");
    }
    if (arg == null) {
      throw new MalformedFilterException("'" + op.value() + "' requires a symbol argument");
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
    node.set("arg", arg.toJson());
    return node;
  }
}

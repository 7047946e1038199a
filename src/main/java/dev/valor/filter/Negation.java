package dev.valor.filter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Logical negation of a nested expression. */
public record Negation(FilterExpression arg) implements FilterExpression {

  public Negation {
    if (arg == null) {
      throw new MalformedFilterException("'not' requires an expression argument");
    }
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("op", FilterOperator.NOT.value());
    node.set("arg", arg.toJson());
    return node;
  }
}

package dev.valor.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Typed literal. The raw JSON value is checked against the type's structural validator on
 * construction, so every {@code Value} instance is well-formed.
 */
public record Value(FilterType type, JsonNode value) implements Operand {

  public Value {
    if (type == null || value == null || value.isNull() || value.isMissingNode()) {
      throw new MalformedFilterException("A value needs a type and a non-null value");
    }
    type.validate(value);
    value = value.deepCopy();
  }

  public static Value of(FilterType type, String text) {
    return new Value(type, JsonNodeFactory.instance.textNode(text));
  }

  public static Value of(long number) {
    return new Value(FilterType.INTEGER, JsonNodeFactory.instance.numberNode(number));
  }

  public static Value of(double number) {
    return new Value(FilterType.FLOAT, JsonNodeFactory.instance.numberNode(number));
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("type", type.value());
    node.set("value", value.deepCopy());
    return node;
  }
}

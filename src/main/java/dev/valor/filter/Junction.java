package dev.valor.filter;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** {@code and} / {@code or} / {@code xor} over an ordered, non-empty list of children. */
public record Junction(FilterOperator op, List<FilterExpression> args)
    implements FilterExpression {

  public Junction {
    if (op == null || op.arity() != FilterOperator.Arity.NARY) {
      throw new MalformedFilterException(
          "'" + (op == null ? null : op.value()) + "' is not a logical junction");
    }
    if (args == null || args.isEmpty()) {
      throw new MalformedFilterException("'" + op.value() + "' requires at least one argument");
    }
    args = List.copyOf(args);
  }

  /**
   * Conjunction of the non-null expressions given. Returns the single expression unchanged when
   * only one remains, or null when none does.
   */
  public static @Nullable FilterExpression allOf(@Nullable FilterExpression... expressions) {
    List<FilterExpression> present = new ArrayList<>();
    for (FilterExpression expression : expressions) {
      if (expression != null) {
        present.add(expression);
      }
    }
    if (present.isEmpty()) {
      return null;
    }
    if (present.size() == 1) {
      return present.get(0);
    }
    return new Junction(FilterOperator.AND, present);
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("op", op.value());
    ArrayNode array = node.putArray("args");
    args.stream().map(FilterExpression::toJson).filter(Objects::nonNull).forEach(array::add);
    return node;
  }
}

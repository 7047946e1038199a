package dev.valor.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.MalformedFilterException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Boolean formula over predicate-set indices, shaped like the filter it was linearized from.
 *
 * <p>JSON form: a bare integer for a leaf, {@code {"not": x}} for a negation and {@code
 * {"and"|"or"|"xor": [x, ...]}} for junctions. Every object has exactly one key.
 */
public interface Skeleton {

  JsonNode toJson();

  /**
   * Evaluates the formula for a given assignment of predicate flags.
   *
   * @param flags flag value per predicate-set index
   * @return the truth value of the whole formula
   */
  boolean evaluate(List<Boolean> flags);

  /**
   * Renders the formula as a SQL boolean expression.
   *
   * @param leaf SQL for the flag of a predicate-set index
   * @return a parenthesized boolean expression
   */
  String toSql(IntFunction<String> leaf);

  /** Number of leaf indices in the formula. */
  int leafCount();

  /** Reference to the predicate set at {@code index}. */
  record Leaf(int index) implements Skeleton {

    public Leaf {
      if (index < 0) {
        throw new MalformedFilterException("Predicate index must not be negative: " + index);
      }
    }

    @Override
    public JsonNode toJson() {
      return JsonNodeFactory.instance.numberNode(index);
    }

    @Override
    public boolean evaluate(List<Boolean> flags) {
      return flags.get(index);
    }

    @Override
    public String toSql(IntFunction<String> leaf) {
      return "(" + leaf.apply(index) + " = true)";
    }

    @Override
    public int leafCount() {
      return 1;
    }
  }

  /** Logical negation. */
  record Not(Skeleton arg) implements Skeleton {

    @Override
    public JsonNode toJson() {
      ObjectNode node = JsonNodeFactory.instance.objectNode();
      node.set(FilterOperator.NOT.value(), arg.toJson());
      return node;
    }

    @Override
    public boolean evaluate(List<Boolean> flags) {
      return !arg.evaluate(flags);
    }

    @Override
    public String toSql(IntFunction<String> leaf) {
      return "(NOT " + arg.toSql(leaf) + ")";
    }

    @Override
    public int leafCount() {
      return arg.leafCount();
    }
  }

  /** {@code and}, {@code or} or {@code xor} over one or more sub-formulas. */
  record Connective(FilterOperator op, List<Skeleton> args) implements Skeleton {

    public Connective {
      if (op.arity() != FilterOperator.Arity.NARY) {
        throw new MalformedFilterException("'" + op.value() + "' is not a logical junction");
      }
      if (args.isEmpty()) {
        throw new MalformedFilterException("'" + op.value() + "' requires at least one argument");
      }
      args = List.copyOf(args);
    }

    @Override
    public JsonNode toJson() {
      ObjectNode node = JsonNodeFactory.instance.objectNode();
      ArrayNode array = node.putArray(op.value());
      args.forEach(arg -> array.add(arg.toJson()));
      return node;
    }

    @Override
    public boolean evaluate(List<Boolean> flags) {
      if (op == FilterOperator.AND) {
        return args.stream().allMatch(arg -> arg.evaluate(flags));
      }
      if (op == FilterOperator.OR) {
        return args.stream().anyMatch(arg -> arg.evaluate(flags));
      }
      return args.stream().filter(arg -> arg.evaluate(flags)).count() % 2 == 1;
    }

    @Override
    public String toSql(IntFunction<String> leaf) {
      List<String> parts = new ArrayList<>(args.size());
      if (op == FilterOperator.XOR) {
        for (Skeleton arg : args) {
          parts.add("CASE WHEN " + arg.toSql(leaf) + " THEN 1 ELSE 0 END");
        }
        return "((" + String.join(" + ", parts) + ") % 2 = 1)";
      }
      for (Skeleton arg : args) {
        parts.add(arg.toSql(leaf));
      }
      String separator = op == FilterOperator.AND ? " AND " : " OR ";
      return "(" + String.join(separator, parts) + ")";
    }

    @Override
    public int leafCount() {
      return args.stream().mapToInt(Skeleton::leafCount).sum();
    }
  }

  /**
   * Reads the JSON form back.
   *
   * @param node an integer or a single-key object
   * @return the parsed formula
   * @throws MalformedFilterException for any other shape
   */
  static Skeleton fromJson(JsonNode node) {
    if (node.isIntegralNumber()) {
      return new Leaf(node.asInt());
    }
    if (!node.isObject() || node.size() != 1) {
      throw new MalformedFilterException(
          "A formula node must be an integer or an object with exactly one key: " + node);
    }
    Iterator<String> names = node.fieldNames();
    String key = names.next();
    FilterOperator op = FilterOperator.fromValue(key);
    JsonNode body = node.get(key);
    if (op == FilterOperator.NOT) {
      if (body.isArray()) {
        throw new MalformedFilterException("'not' takes a single argument, not a list");
      }
      return new Not(fromJson(body));
    }
    if (op.arity() != FilterOperator.Arity.NARY || !body.isArray()) {
      throw new MalformedFilterException("'" + key + "' is not a valid formula node");
    }
    List<Skeleton> args = new ArrayList<>(body.size());
    body.forEach(child -> args.add(fromJson(child)));
    return new Connective(op, args);
  }
}

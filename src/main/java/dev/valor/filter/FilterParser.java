package dev.valor.filter;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Turns the JSON form of a filter into a {@link FilterExpression} tree.
 *
 * <pre>
 * Expr   := {op: not|isnull|isnotnull, arg: Symbol|Expr}
 *         | {op: eq|ne|gt|ge|lt|le|intersects|inside|outside|contains,
 *            lhs: Symbol, rhs: Value|Symbol}
 *         | {op: and|or|xor, args: [Expr, ...]}
 * Symbol := {name, key?, attribute?, dtype}
 * Value  := {type, value}
 * </pre>
 *
 * <p>Only the shape of the document is checked here. Whether operators fit their operand types is
 * decided when the tree is compiled.
 */
public final class FilterParser {

  private FilterParser() {
    // utility class
  }

  /**
   * Parses a filter document.
   *
   * @param node the JSON filter, or null / JSON null for "no filter"
   * @return the expression tree, or null when the document is absent
   * @throws MalformedFilterException if the document does not have the expected shape
   * @throws UnknownSymbolException if a symbol or attribute modifier is not registered
   */
  public static @Nullable FilterExpression parse(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    return parseExpression(node);
  }

  private static FilterExpression parseExpression(JsonNode node) {
    if (!node.isObject()) {
      throw new MalformedFilterException(
          "Expected an expression object, got " + node.getNodeType());
    }
    JsonNode opNode = node.get("op");
    if (opNode == null || !opNode.isTextual()) {
      throw new MalformedFilterException("Expression is missing the 'op' field");
    }
    FilterOperator op = FilterOperator.fromValue(opNode.asText());
    if (op.arity() == FilterOperator.Arity.UNARY) {
      return parseUnary(op, node);
    }
    if (op.arity() == FilterOperator.Arity.BINARY) {
      if (node.has("arg") && !node.has("lhs")) {
        throw new MalformedFilterException("'" + op.value() + "' is binary; use 'lhs' and 'rhs'");
      }
      return new Comparison(
          op, parseSymbol(required(node, "lhs", op)), parseOperand(required(node, "rhs", op)));
    }
    JsonNode args = required(node, "args", op);
    if (!args.isArray()) {
      throw new MalformedFilterException("'" + op.value() + "' expects 'args' to be a list");
    }
    List<FilterExpression> children = new ArrayList<>(args.size());
    for (JsonNode child : args) {
      children.add(parseExpression(child));
    }
    return new Junction(op, children);
  }

  private static FilterExpression parseUnary(FilterOperator op, JsonNode node) {
    if (node.has("args") || node.has("lhs")) {
      throw new MalformedFilterException("'" + op.value() + "' is unary; use a single 'arg'");
    }
    JsonNode arg = required(node, "arg", op);
    if (arg.isArray()) {
      throw new MalformedFilterException(
          "'" + op.value() + "' takes a single argument, not a list");
    }
    if (op == FilterOperator.NOT) {
      return new Negation(parseExpression(arg));
    }
    return new NullCheck(op, parseSymbol(arg));
  }

  private static Operand parseOperand(JsonNode node) {
    if (node.isObject() && node.has("name")) {
      return parseSymbol(node);
    }
    return parseValue(node);
  }

  static Symbol parseSymbol(JsonNode node) {
    if (!node.isObject()) {
      throw new MalformedFilterException("Expected a symbol object");
    }
    String name = requiredText(node, "name", "symbol");
    String dtype = requiredText(node, "dtype", "symbol");
    String key = optionalText(node, "key");
    String attribute = optionalText(node, "attribute");
    return new Symbol(
        SymbolName.fromValue(name),
        key,
        attribute == null ? null : AttributeModifier.fromValue(attribute),
        FilterType.fromValue(dtype));
  }

  static Value parseValue(JsonNode node) {
    if (!node.isObject()) {
      throw new MalformedFilterException("Expected a value object");
    }
    String type = requiredText(node, "type", "value");
    JsonNode value = node.get("value");
    if (value == null) {
      throw new MalformedFilterException("Value is missing the 'value' field");
    }
    return new Value(FilterType.fromValue(type), value);
  }

  private static JsonNode required(JsonNode node, String field, FilterOperator op) {
    JsonNode child = node.get(field);
    if (child == null || child.isNull()) {
      throw new MalformedFilterException("'" + op.value() + "' requires '" + field + "'");
    }
    return child;
  }

  private static String requiredText(JsonNode node, String field, String what) {
    JsonNode child = node.get(field);
    if (child == null || !child.isTextual()) {
      throw new MalformedFilterException("A " + what + " requires a string '" + field + "'");
    }
    return child.asText();
  }

  private static @Nullable String optionalText(JsonNode node, String field) {
    JsonNode child = node.get(field);
    if (child == null || child.isNull()) {
      return null;
    }
    if (!child.isTextual()) {
      throw new MalformedFilterException("'" + field + "' must be a string");
    }
    return child.asText();
  }
}

package dev.valor.filter;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

/**
 * Reference to a registered attribute, optionally indexed by a metadata {@code key} and optionally
 * transformed by an attribute modifier.
 *
 * @param name the registered attribute
 * @param key metadata field name, only for dictionary-valued attributes
 * @param attribute derived scalar to take from the attribute, e.g. its area
 * @param dtype declared type of the referenced value
 */
public record Symbol(
    SymbolName name, @Nullable String key, @Nullable AttributeModifier attribute, FilterType dtype)
    implements Operand {

  public Symbol {
    if (name == null || dtype == null) {
      throw new MalformedFilterException("A symbol needs a name and a dtype");
    }
    if (key != null && key.isBlank()) {
      throw new MalformedFilterException("Symbol key must not be blank");
    }
  }

  /** Plain reference without key or modifier. */
  public static Symbol of(SymbolName name, FilterType dtype) {
    return new Symbol(name, null, null, dtype);
  }

  @Override
  public FilterType type() {
    return dtype;
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("name", name.value());
    if (key != null) {
      node.put("key", key);
    }
    if (attribute != null) {
      node.put("attribute", attribute.value());
    }
    node.put("dtype", dtype.value());
    return node;
  }
}

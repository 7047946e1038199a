package dev.valor.query;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A filter split into its formula skeleton and the predicate sets the skeleton indexes into.
 *
 * @param skeleton boolean formula over indices into {@code predicateSets}
 * @param predicateSets one compiled predicate per leaf, in depth-first order
 */
public record LinearizedFilter(Skeleton skeleton, List<PredicateSet> predicateSets) {

  public LinearizedFilter {
    predicateSets = List.copyOf(predicateSets);
  }

  /**
   * Deterministic JSON rendering of the whole compiled filter, used for fingerprinting. Parameters
   * are sorted by name and rendered as strings.
   */
  public ObjectNode canonicalJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.set("skeleton", skeleton.toJson());
    ArrayNode predicates = node.putArray("predicates");
    for (PredicateSet set : predicateSets) {
      ObjectNode predicate = predicates.addObject();
      predicate.put("owner", set.owner().table());
      predicate.put("sql", set.sql());
      ObjectNode params = predicate.putObject("params");
      for (Map.Entry<String, Object> param : new TreeMap<>(set.params()).entrySet()) {
        params.put(param.getKey(), String.valueOf(param.getValue()));
      }
    }
    return node;
  }
}

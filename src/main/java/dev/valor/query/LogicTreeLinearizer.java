package dev.valor.query;

import dev.valor.filter.FilterExpression;
import dev.valor.filter.Junction;
import dev.valor.filter.MalformedFilterException;
import dev.valor.filter.Negation;
import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first walk that compiles every leaf of a filter into a {@link PredicateSet} and replaces it
 * by its index in the resulting list.
 *
 * <p>Identical leaves are compiled once per occurrence; the list is never deduplicated.
 */
public final class LogicTreeLinearizer {

  private LogicTreeLinearizer() {
    // utility class
  }

  /**
   * Linearizes {@code expression}.
   *
   * @param expression the parsed filter
   * @param namespace prefix for CTE and parameter names, so several filters can share a statement
   * @return the skeleton and its predicate sets
   */
  public static LinearizedFilter linearize(FilterExpression expression, String namespace) {
    List<PredicateSet> predicateSets = new ArrayList<>();
    Skeleton skeleton = walk(expression, namespace, predicateSets);
    return new LinearizedFilter(skeleton, predicateSets);
  }

  private static Skeleton walk(
      FilterExpression expression, String namespace, List<PredicateSet> predicateSets) {
    if (expression.isLeaf()) {
      int index = predicateSets.size();
      predicateSets.add(PredicateCompiler.compileLeaf(expression, namespace + "ps" + index));
      return new Skeleton.Leaf(index);
    }
    if (expression instanceof Negation negation) {
      return new Skeleton.Not(walk(negation.arg(), namespace, predicateSets));
    }
    if (expression instanceof Junction junction) {
      List<Skeleton> children = new ArrayList<>(junction.args().size());
      for (FilterExpression child : junction.args()) {
        children.add(walk(child, namespace, predicateSets));
      }
      return new Skeleton.Connective(junction.op(), children);
    }
    throw new MalformedFilterException(
        "Unsupported expression node " + expression.getClass().getSimpleName());
  }
}

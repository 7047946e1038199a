package dev.valor.query;

import dev.valor.filter.OwnerEntity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compiled form of one leaf comparison: a SELECT returning the {@code id} of every owner row that
 * satisfies the comparison, plus its bind parameters.
 *
 * @param name CTE name under which the planner registers the query
 * @param owner entity whose ids the query returns
 * @param sql the SELECT statement, referencing only named parameters from {@code params}
 * @param params bind values keyed by parameter name, in binding order
 */
public record PredicateSet(String name, OwnerEntity owner, String sql, Map<String, Object> params) {

  public PredicateSet {
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}

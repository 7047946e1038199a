package dev.valor.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A planned, executable statement with its named bind parameters.
 *
 * @param sql the statement text
 * @param params bind values keyed by parameter name
 */
public record FilterQuery(String sql, Map<String, Object> params) {

  public FilterQuery {
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}

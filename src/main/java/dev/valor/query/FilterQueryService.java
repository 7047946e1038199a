package dev.valor.query;

import dev.valor.filter.FilterExpression;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

/**
 * Entry point for filtered reads: linearizes a filter, plans it for a pivot and link table, and
 * optionally runs it. Compilation is pure and may run concurrently without coordination.
 */
@Service
public class FilterQueryService {

  private final FilterQueryExecutor executor;

  public FilterQueryService(FilterQueryExecutor executor) {
    this.executor = executor;
  }

  /**
   * Compiles a filter into a planned statement without executing it.
   *
   * @param filter the parsed filter, or null for no restriction
   * @param pivot row granularity
   * @param link link table to reach labels through
   * @param columns output columns
   * @param namespace prefix for generated CTE and parameter names
   * @return the planned statement
   */
  public FilterQuery compile(
      @Nullable FilterExpression filter,
      Pivot pivot,
      LinkTable link,
      List<SelectableColumn> columns,
      String namespace) {
    LinearizedFilter linearized =
        filter == null ? null : LogicTreeLinearizer.linearize(filter, namespace);
    return QueryPlanner.plan(linearized, pivot, link, columns, namespace);
  }

  /**
   * Compiles and executes a filter.
   *
   * @return one map per selected row, keyed by column alias
   */
  public List<Map<String, Object>> select(
      @Nullable FilterExpression filter,
      Pivot pivot,
      LinkTable link,
      List<SelectableColumn> columns) {
    return executor.queryForList(compile(filter, pivot, link, columns, ""));
  }
}

package dev.valor.query;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Runs planned {@link FilterQuery} statements. Bind values are never logged. */
@Repository
public class FilterQueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(FilterQueryExecutor.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public FilterQueryExecutor(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Executes a query and returns its rows keyed by column alias.
   *
   * @param query the planned statement
   * @return one map per row
   */
  public List<Map<String, Object>> queryForList(FilterQuery query) {
    log.debug("Executing filter query with {} parameters: {}", query.params().size(), query.sql());
    return jdbcTemplate.queryForList(query.sql(), query.params());
  }

  /**
   * Executes a query and maps each row.
   *
   * @param query the planned statement
   * @param rowMapper row mapping function
   * @param <T> row type
   * @return mapped rows
   */
  public <T> List<T> query(FilterQuery query, RowMapper<T> rowMapper) {
    log.debug("Executing filter query with {} parameters: {}", query.params().size(), query.sql());
    return jdbcTemplate.query(query.sql(), query.params(), rowMapper);
  }
}

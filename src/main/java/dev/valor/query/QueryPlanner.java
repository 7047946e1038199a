package dev.valor.query;

import dev.valor.filter.OwnerEntity;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import org.jspecify.annotations.Nullable;

/**
 * Turns a {@link LinearizedFilter} into one statement over the dataset hierarchy.
 *
 * <p>Every predicate set becomes a CTE. An aggregation CTE outer-joins each of them onto the pivot
 * and reduces the matches to one two-valued flag per predicate and pivot row. The final SELECT
 * walks datasets, datums, annotations and the chosen link table, and keeps the pivot rows whose
 * flags satisfy the rendered skeleton.
 */
public final class QueryPlanner {

  private static final String LABEL_LINK = "label_link";

  private QueryPlanner() {
    // utility class
  }

  /**
   * Plans a query.
   *
   * @param filter the linearized filter, or null to select everything
   * @param pivot granularity of the returned rows
   * @param link link table joining annotations to labels
   * @param columns output columns, in select order
   * @param namespace prefix used when the filter was linearized
   * @return the executable statement
   * @throws IllegalArgumentException if no columns are requested or a column is not available on
   *     the pivot
   */
  public static FilterQuery plan(
      @Nullable LinearizedFilter filter,
      Pivot pivot,
      LinkTable link,
      List<SelectableColumn> columns,
      String namespace) {
    if (columns.isEmpty()) {
      throw new IllegalArgumentException("At least one output column is required");
    }
    for (SelectableColumn column : columns) {
      if (pivot == Pivot.DATUM && !column.isDatumLevel()) {
        throw new IllegalArgumentException(
            "Column '" + column.alias() + "' is not available when pivoting on datums");
      }
    }

    Map<String, Object> params = new LinkedHashMap<>();
    StringBuilder sql = new StringBuilder();
    String agg = namespace + "agg";

    if (filter != null) {
      StringJoiner with = new StringJoiner(",\n", "WITH ", "\n");
      for (PredicateSet set : filter.predicateSets()) {
        with.add(set.name() + " AS (" + set.sql() + ")");
        params.putAll(set.params());
      }
      with.add(agg + " AS (" + aggregation(filter, pivot, link) + ")");
      sql.append(with);
    }

    StringJoiner select = new StringJoiner(", ", "SELECT DISTINCT ", "\n");
    columns.forEach(column -> select.add(column.selectSql(link)));
    sql.append(select);

    sql.append("FROM ").append(pivot.table()).append('\n');
    if (pivot == Pivot.ANNOTATION) {
      sql.append("JOIN datums ON datums.id = annotations.datum_id\n")
          .append("JOIN datasets ON datasets.id = datums.dataset_id\n")
          .append("LEFT JOIN models ON models.id = annotations.model_id\n")
          .append("JOIN ")
          .append(link.table())
          .append(" ON ")
          .append(link.table())
          .append(".annotation_id = annotations.id\n")
          .append("JOIN labels ON labels.id = ")
          .append(link.table())
          .append(".label_id\n");
    } else {
      sql.append("JOIN datasets ON datasets.id = datums.dataset_id\n");
    }

    if (filter != null) {
      sql.append("JOIN ")
          .append(agg)
          .append(" ON ")
          .append(agg)
          .append(".pivot_id = ")
          .append(pivot.table())
          .append(".id\n")
          .append("WHERE ")
          .append(filter.skeleton().toSql(index -> agg + ".flag_" + index));
    }
    return new FilterQuery(sql.toString().strip(), params);
  }

  private static String aggregation(LinearizedFilter filter, Pivot pivot, LinkTable link) {
    Set<OwnerEntity> owners = EnumSet.noneOf(OwnerEntity.class);
    filter.predicateSets().forEach(set -> owners.add(set.owner()));

    StringBuilder sql =
        new StringBuilder("SELECT ").append(pivot.table()).append(".id AS pivot_id");
    List<PredicateSet> sets = filter.predicateSets();
    for (int i = 0; i < sets.size(); i++) {
      sql.append(", COALESCE(bool_or(")
          .append(sets.get(i).name())
          .append(".id IS NOT NULL), false) AS flag_")
          .append(i);
    }
    sql.append(" FROM ").append(pivot.table());

    boolean needsAnnotations =
        owners.contains(OwnerEntity.ANNOTATION)
            || owners.contains(OwnerEntity.MODEL)
            || owners.contains(OwnerEntity.EMBEDDING)
            || owners.contains(OwnerEntity.LABEL);
    if (pivot == Pivot.ANNOTATION) {
      sql.append(" JOIN datums ON datums.id = annotations.datum_id");
      sql.append(" JOIN datasets ON datasets.id = datums.dataset_id");
    } else {
      sql.append(" JOIN datasets ON datasets.id = datums.dataset_id");
      if (needsAnnotations) {
        sql.append(" LEFT JOIN annotations ON annotations.datum_id = datums.id");
      }
    }
    if (owners.contains(OwnerEntity.MODEL)) {
      sql.append(" LEFT JOIN models ON models.id = annotations.model_id");
    }
    if (owners.contains(OwnerEntity.EMBEDDING)) {
      sql.append(" LEFT JOIN embeddings ON embeddings.id = annotations.embedding_id");
    }
    if (owners.contains(OwnerEntity.LABEL)) {
      sql.append(" LEFT JOIN ")
          .append(link.table())
          .append(" AS ")
          .append(LABEL_LINK)
          .append(" ON ")
          .append(LABEL_LINK)
          .append(".annotation_id = annotations.id");
    }
    for (PredicateSet set : sets) {
      sql.append(" LEFT JOIN ")
          .append(set.name())
          .append(" ON ")
          .append(set.name())
          .append(".id = ")
          .append(ownerReference(set.owner()));
    }
    sql.append(" GROUP BY ").append(pivot.table()).append(".id");
    return sql.toString();
  }

  private static String ownerReference(OwnerEntity owner) {
    if (owner == OwnerEntity.LABEL) {
      return LABEL_LINK + ".label_id";
    }
    return owner.idColumn();
  }
}

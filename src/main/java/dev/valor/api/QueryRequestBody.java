package dev.valor.api;

import com.fasterxml.jackson.databind.JsonNode;
import dev.valor.query.LinkTable;
import dev.valor.query.Pivot;
import dev.valor.query.SelectableColumn;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /queries}.
 *
 * @param filter filter expression in its JSON form, or null for no restriction
 * @param pivot row granularity (default annotation)
 * @param link link table labels are reached through (default groundtruth)
 * @param columns output columns
 */
public record QueryRequestBody(
    @Nullable JsonNode filter,
    @Nullable Pivot pivot,
    @Nullable LinkTable link,
    List<SelectableColumn> columns) {

  /** Compact constructor applying defaults. */
  public QueryRequestBody {
    pivot = pivot == null ? Pivot.ANNOTATION : pivot;
    link = link == null ? LinkTable.GROUND_TRUTHS : link;
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}

package dev.valor.evaluation.metrics;

import dev.valor.query.FilterQuery;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combines a ground-truth and a prediction query into one statement whose body can join {@code gt}
 * and {@code pd}, each exposing {@code annotation_id} and {@code datum_id}.
 */
final class PairwiseSql {

  private PairwiseSql() {
    // utility class
  }

  static FilterQuery over(FilterQuery groundTruths, FilterQuery predictions, String body) {
    String sql =
        "WITH gt AS ("
            + groundTruths.sql()
            + "),\npd AS ("
            + predictions.sql()
            + ")\n"
            + body;
    Map<String, Object> params = new LinkedHashMap<>(groundTruths.params());
    params.putAll(predictions.params());
    return new FilterQuery(sql, params);
  }

  /** FROM clause pairing every ground truth with every prediction on the same datum. */
  static String sameDatumPairs() {
    return "FROM (SELECT DISTINCT annotation_id, datum_id FROM gt) AS gts\n"
        + "JOIN (SELECT DISTINCT annotation_id, datum_id FROM pd) AS pds"
        + " ON pds.datum_id = gts.datum_id\n"
        + "JOIN annotations AS g ON g.id = gts.annotation_id\n"
        + "JOIN annotations AS p ON p.id = pds.annotation_id\n";
  }
}

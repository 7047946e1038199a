package dev.valor.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.valor.filter.Comparison;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.FilterType;
import dev.valor.filter.Junction;
import dev.valor.filter.Negation;
import dev.valor.filter.Symbol;
import dev.valor.filter.SymbolName;
import dev.valor.filter.Value;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryPlannerTest {

  private static final List<SelectableColumn> ANNOTATION_COLUMNS =
      List.of(SelectableColumn.ANNOTATION_ID, SelectableColumn.LABEL_VALUE);

  private static Comparison datasetIs(String name) {
    return new Comparison(
        FilterOperator.EQ,
        Symbol.of(SymbolName.DATASET_NAME, FilterType.STRING),
        Value.of(FilterType.STRING, name));
  }

  private static Comparison labelIs(String key, String value) {
    ObjectNode label = JsonNodeFactory.instance.objectNode().put("key", key).put("value", value);
    return new Comparison(
        FilterOperator.EQ,
        Symbol.of(SymbolName.ANNOTATION_LABELS, FilterType.LABEL),
        new Value(FilterType.LABEL, label));
  }

  private static FilterQuery plan(
      FilterExpression filter, Pivot pivot, List<SelectableColumn> columns) {
    return QueryPlanner.plan(
        LogicTreeLinearizer.linearize(filter, ""), pivot, LinkTable.GROUND_TRUTHS, columns, "");
  }

  @Test
  void withoutFilterSelectsEverythingThroughTheLink() {
    FilterQuery query =
        QueryPlanner.plan(null, Pivot.ANNOTATION, LinkTable.PREDICTIONS, ANNOTATION_COLUMNS, "");

    assertThat(query.sql())
        .startsWith("SELECT DISTINCT annotations.id AS annotation_id, labels.value AS label_value")
        .contains("JOIN predictions ON predictions.annotation_id = annotations.id")
        .contains("JOIN labels ON labels.id = predictions.label_id")
        .doesNotContain("WITH")
        .doesNotContain("WHERE");
    assertThat(query.params()).isEmpty();
  }

  @Test
  void filterBecomesCtesAggregatedIntoFlags() {
    FilterQuery query = plan(datasetIs("ds1"), Pivot.ANNOTATION, ANNOTATION_COLUMNS);

    assertThat(query.sql())
        .startsWith("WITH ps0 AS (SELECT datasets.id AS id FROM datasets WHERE")
        .contains("agg AS (SELECT annotations.id AS pivot_id")
        .contains("COALESCE(bool_or(ps0.id IS NOT NULL), false) AS flag_0")
        .contains("LEFT JOIN ps0 ON ps0.id = datasets.id")
        .contains("JOIN agg ON agg.pivot_id = annotations.id")
        .endsWith("WHERE (agg.flag_0 = true)");
    assertThat(query.params()).containsEntry("ps0_0", "ds1");
  }

  @Test
  void negationIsLogicalComplementOfTheFlag() {
    FilterQuery query =
        plan(new Negation(datasetIs("ds1")), Pivot.DATUM, List.of(SelectableColumn.DATUM_UID));

    // pivot rows without any match carry flag false rather than NULL, so NOT keeps them
    assertThat(query.sql())
        .contains("COALESCE(bool_or(ps0.id IS NOT NULL), false) AS flag_0")
        .endsWith("WHERE (NOT (agg.flag_0 = true))");
  }

  @Test
  void xorRendersParity() {
    FilterExpression filter =
        new Junction(FilterOperator.XOR, List.of(datasetIs("a"), datasetIs("b")));

    FilterQuery query = plan(filter, Pivot.DATUM, List.of(SelectableColumn.DATUM_ID));

    assertThat(query.sql()).contains("% 2 = 1");
    assertThat(query.params()).containsOnlyKeys("ps0_0", "ps1_0");
  }

  @Test
  void labelPredicateOnDatumPivotJoinsThroughAnnotationsAndLink() {
    FilterQuery query =
        plan(labelIs("class", "dog"), Pivot.DATUM, List.of(SelectableColumn.DATUM_UID));

    assertThat(query.sql())
        .contains("LEFT JOIN annotations ON annotations.datum_id = datums.id")
        .contains(
            "LEFT JOIN groundtruths AS label_link ON label_link.annotation_id = annotations.id")
        .contains("LEFT JOIN ps0 ON ps0.id = label_link.label_id")
        .contains("GROUP BY datums.id");
  }

  @Test
  void scoreIsNullForGroundTruths() {
    FilterQuery query =
        QueryPlanner.plan(
            null, Pivot.ANNOTATION, LinkTable.GROUND_TRUTHS, List.of(SelectableColumn.SCORE), "");

    assertThat(query.sql()).contains("CAST(NULL AS double precision) AS score");
  }

  @Test
  void annotationColumnOnDatumPivotIsRejected() {
    assertThatThrownBy(
            () ->
                QueryPlanner.plan(
                    null, Pivot.DATUM, LinkTable.GROUND_TRUTHS, ANNOTATION_COLUMNS, ""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("annotation_id");
  }

  @Test
  void emptyColumnListIsRejected() {
    assertThatThrownBy(
            () -> QueryPlanner.plan(null, Pivot.ANNOTATION, LinkTable.GROUND_TRUTHS, List.of(), ""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void namespacedPlansCanShareAStatement() {
    FilterQuery query =
        QueryPlanner.plan(
            LogicTreeLinearizer.linearize(datasetIs("ds1"), "gt_"),
            Pivot.ANNOTATION,
            LinkTable.GROUND_TRUTHS,
            ANNOTATION_COLUMNS,
            "gt_");

    assertThat(query.sql()).contains("gt_ps0 AS (").contains("gt_agg AS (");
    assertThat(query.params()).containsOnlyKeys("gt_ps0_0");
  }
}

package dev.valor.evaluation.metrics;

import dev.valor.filter.Comparison;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.FilterType;
import dev.valor.filter.Junction;
import dev.valor.filter.Symbol;
import dev.valor.filter.SymbolName;
import dev.valor.filter.Value;
import dev.valor.query.FilterQuery;
import dev.valor.query.FilterQueryExecutor;
import dev.valor.query.FilterQueryService;
import dev.valor.query.LinkTable;
import dev.valor.query.Pivot;
import dev.valor.query.SelectableColumn;
import dev.valor.schema.Label;
import dev.valor.schema.TaskType;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Builds and runs the ground-truth and prediction queries every metric computer starts from.
 *
 * <p>Ground truths: datum filter AND task type, through the ground-truth link. Predictions: datum
 * filter AND model name AND task type, through the prediction link.
 */
@Component
public class AnnotationQueries {

  static final String GROUND_TRUTH_NAMESPACE = "gt_";
  static final String PREDICTION_NAMESPACE = "pd_";

  static final List<SelectableColumn> COLUMNS =
      List.of(
          SelectableColumn.ANNOTATION_ID,
          SelectableColumn.DATUM_ID,
          SelectableColumn.LABEL_KEY,
          SelectableColumn.LABEL_VALUE,
          SelectableColumn.SCORE);

  private final FilterQueryService filterQueryService;
  private final FilterQueryExecutor executor;

  public AnnotationQueries(FilterQueryService filterQueryService, FilterQueryExecutor executor) {
    this.filterQueryService = filterQueryService;
    this.executor = executor;
  }

  static FilterExpression groundTruthFilter(
      @Nullable FilterExpression datumFilter, TaskType taskType) {
    return Junction.allOf(datumFilter, taskTypeIs(taskType));
  }

  static FilterExpression predictionFilter(
      @Nullable FilterExpression datumFilter, String modelName, TaskType taskType) {
    Comparison modelIs =
        new Comparison(
            FilterOperator.EQ,
            Symbol.of(SymbolName.MODEL_NAME, FilterType.STRING),
            Value.of(FilterType.STRING, modelName));
    return Junction.allOf(datumFilter, modelIs, taskTypeIs(taskType));
  }

  private static Comparison taskTypeIs(TaskType taskType) {
    return new Comparison(
        FilterOperator.EQ,
        Symbol.of(SymbolName.ANNOTATION_TASK_TYPE, FilterType.TASK_TYPE),
        Value.of(FilterType.TASK_TYPE, taskType.value()));
  }

  FilterQuery groundTruthQuery(@Nullable FilterExpression datumFilter, TaskType taskType) {
    return filterQueryService.compile(
        groundTruthFilter(datumFilter, taskType),
        Pivot.ANNOTATION,
        LinkTable.GROUND_TRUTHS,
        COLUMNS,
        GROUND_TRUTH_NAMESPACE);
  }

  FilterQuery predictionQuery(
      @Nullable FilterExpression datumFilter, String modelName, TaskType taskType) {
    return filterQueryService.compile(
        predictionFilter(datumFilter, modelName, taskType),
        Pivot.ANNOTATION,
        LinkTable.PREDICTIONS,
        COLUMNS,
        PREDICTION_NAMESPACE);
  }

  List<LabeledAnnotation> groundTruths(@Nullable FilterExpression datumFilter, TaskType taskType) {
    return fetch(groundTruthQuery(datumFilter, taskType));
  }

  List<LabeledAnnotation> predictions(
      @Nullable FilterExpression datumFilter, String modelName, TaskType taskType) {
    return fetch(predictionQuery(datumFilter, modelName, taskType));
  }

  private List<LabeledAnnotation> fetch(FilterQuery query) {
    return executor.query(
        query,
        (rs, rowNum) -> {
          long annotationId = rs.getLong("annotation_id");
          long datumId = rs.getLong("datum_id");
          Label label = new Label(rs.getString("label_key"), rs.getString("label_value"));
          double score = rs.getDouble("score");
          return new LabeledAnnotation(annotationId, datumId, label, rs.wasNull() ? null : score);
        });
  }
}

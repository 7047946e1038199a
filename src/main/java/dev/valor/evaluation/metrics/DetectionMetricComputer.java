package dev.valor.evaluation.metrics;

import dev.valor.filter.FilterExpression;
import dev.valor.query.FilterQuery;
import dev.valor.query.FilterQueryExecutor;
import dev.valor.schema.TaskType;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Object-detection AP. IOUs are computed in the database on the annotation box, falling back to its
 * polygon; matching and interpolation happen in {@link AveragePrecision}.
 */
@Component
public class DetectionMetricComputer implements MetricComputer {

  private static final Logger log = LoggerFactory.getLogger(DetectionMetricComputer.class);

  private static final String GT_SHAPE = "COALESCE(g.box, g.polygon)";
  private static final String PD_SHAPE = "COALESCE(p.box, p.polygon)";

  static final String IOU_SQL =
      "SELECT gts.annotation_id AS groundtruth_id, pds.annotation_id AS prediction_id,"
          + " ST_Area(ST_Intersection(" + GT_SHAPE + ", " + PD_SHAPE + "))"
          + " / NULLIF(ST_Area(ST_Union(" + GT_SHAPE + ", " + PD_SHAPE + ")), 0) AS iou\n"
          + PairwiseSql.sameDatumPairs()
          + "WHERE ST_Intersects(" + GT_SHAPE + ", " + PD_SHAPE + ")";

  private final AnnotationQueries annotationQueries;
  private final FilterQueryExecutor executor;

  public DetectionMetricComputer(
      AnnotationQueries annotationQueries, FilterQueryExecutor executor) {
    this.annotationQueries = annotationQueries;
    this.executor = executor;
  }

  @Override
  public TaskType taskType() {
    return TaskType.OBJECT_DETECTION;
  }

  @Override
  public MetricResults compute(
      String modelName, @Nullable FilterExpression datumFilter, EvaluationParameters parameters) {
    TaskType taskType = TaskType.OBJECT_DETECTION;
    GrouperMappings mappings = GrouperMappings.of(parameters.labelMap());
    List<LabeledAnnotation> groundTruths =
        annotationQueries.groundTruths(datumFilter, taskType).stream()
            .map(row -> row.grouped(mappings))
            .toList();
    List<LabeledAnnotation> predictions =
        annotationQueries.predictions(datumFilter, modelName, taskType).stream()
            .map(row -> row.grouped(mappings))
            .toList();

    FilterQuery overlapsQuery =
        PairwiseSql.over(
            annotationQueries.groundTruthQuery(datumFilter, taskType),
            annotationQueries.predictionQuery(datumFilter, modelName, taskType),
            IOU_SQL);
    List<AveragePrecision.Overlap> overlaps =
        executor.query(
            overlapsQuery,
            (rs, rowNum) ->
                new AveragePrecision.Overlap(
                    rs.getLong("groundtruth_id"),
                    rs.getLong("prediction_id"),
                    rs.getDouble("iou")));
    log.debug(
        "Detection for model {}: {} ground truths, {} predictions, {} overlapping pairs",
        modelName,
        groundTruths.size(),
        predictions.size(),
        overlaps.size());

    return new MetricResults(
        AveragePrecision.compute(modelName, groundTruths, predictions, overlaps, parameters),
        List.of());
  }
}

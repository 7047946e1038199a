package dev.valor.evaluation.metrics;

import dev.valor.filter.FilterExpression;
import dev.valor.query.FilterQuery;
import dev.valor.query.FilterQueryExecutor;
import dev.valor.schema.Label;
import dev.valor.schema.TaskType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Pixel IOU per grouper label over raster annotations, and their mean. */
@Component
public class SemanticSegmentationMetricComputer implements MetricComputer {

  private static final Logger log =
      LoggerFactory.getLogger(SemanticSegmentationMetricComputer.class);

  static final String OVERLAP_SQL =
      "SELECT gts.annotation_id AS groundtruth_id, pds.annotation_id AS prediction_id,"
          + " COALESCE(ST_Count(ST_MapAlgebra(g.raster, p.raster, '[rast1]*[rast2]')), 0)"
          + " AS pixels\n"
          + PairwiseSql.sameDatumPairs()
          + "WHERE g.raster IS NOT NULL AND p.raster IS NOT NULL";

  static final String PIXEL_COUNT_SQL =
      "SELECT a.id AS annotation_id, COALESCE(ST_Count(a.raster), 0) AS pixels"
          + " FROM annotations AS a"
          + " WHERE a.raster IS NOT NULL"
          + " AND a.id IN (SELECT annotation_id FROM gt UNION SELECT annotation_id FROM pd)";

  private final AnnotationQueries annotationQueries;
  private final FilterQueryExecutor executor;

  public SemanticSegmentationMetricComputer(
      AnnotationQueries annotationQueries, FilterQueryExecutor executor) {
    this.annotationQueries = annotationQueries;
    this.executor = executor;
  }

  /** Intersection pixel count of one ground-truth/prediction pair. */
  record PixelOverlap(long groundTruthId, long predictionId, long pixels) {}

  @Override
  public TaskType taskType() {
    return TaskType.SEMANTIC_SEGMENTATION;
  }

  @Override
  public MetricResults compute(
      String modelName, @Nullable FilterExpression datumFilter, EvaluationParameters parameters) {
    TaskType taskType = TaskType.SEMANTIC_SEGMENTATION;
    GrouperMappings mappings = GrouperMappings.of(parameters.labelMap());
    FilterQuery groundTruthQuery = annotationQueries.groundTruthQuery(datumFilter, taskType);
    FilterQuery predictionQuery =
        annotationQueries.predictionQuery(datumFilter, modelName, taskType);

    List<LabeledAnnotation> groundTruths =
        annotationQueries.groundTruths(datumFilter, taskType).stream()
            .map(row -> row.grouped(mappings))
            .toList();
    List<LabeledAnnotation> predictions =
        annotationQueries.predictions(datumFilter, modelName, taskType).stream()
            .map(row -> row.grouped(mappings))
            .toList();
    List<PixelOverlap> overlaps =
        executor.query(
            PairwiseSql.over(groundTruthQuery, predictionQuery, OVERLAP_SQL),
            (rs, rowNum) ->
                new PixelOverlap(
                    rs.getLong("groundtruth_id"),
                    rs.getLong("prediction_id"),
                    rs.getLong("pixels")));
    Map<Long, Long> pixelCounts = new HashMap<>();
    executor
        .queryForList(PairwiseSql.over(groundTruthQuery, predictionQuery, PIXEL_COUNT_SQL))
        .forEach(
            row ->
                pixelCounts.put(
                    ((Number) row.get("annotation_id")).longValue(),
                    ((Number) row.get("pixels")).longValue()));
    log.debug(
        "Segmentation for model {}: {} ground truths, {} predictions, {} overlapping pairs",
        modelName,
        groundTruths.size(),
        predictions.size(),
        overlaps.size());

    return new MetricResults(
        ious(modelName, groundTruths, predictions, overlaps, pixelCounts), List.of());
  }

  /**
   * IOU per grouper label that has at least one ground-truth raster, followed by their mean.
   * A label with ground truths but no predicted pixels scores 0.
   */
  static List<Metric> ious(
      String modelName,
      List<LabeledAnnotation> groundTruths,
      List<LabeledAnnotation> predictions,
      List<PixelOverlap> overlaps,
      Map<Long, Long> pixelCounts) {
    Map<Label, Set<Long>> truthIds = idsByLabel(groundTruths);
    Map<Label, Set<Long>> predictionIds = idsByLabel(predictions);

    List<Metric> metrics = new ArrayList<>();
    double sum = 0.0;
    for (Map.Entry<Label, Set<Long>> entry : truthIds.entrySet()) {
      Set<Long> truths = entry.getValue();
      Set<Long> preds = predictionIds.getOrDefault(entry.getKey(), Set.of());
      long truthPixels = pixelSum(truths, pixelCounts);
      if (truthPixels == 0) {
        continue;
      }
      long predictedPixels = pixelSum(preds, pixelCounts);
      long intersection = 0;
      for (PixelOverlap overlap : overlaps) {
        if (truths.contains(overlap.groundTruthId()) && preds.contains(overlap.predictionId())) {
          intersection += overlap.pixels();
        }
      }
      double iou =
          predictedPixels == 0
              ? 0.0
              : (double) intersection / (truthPixels + predictedPixels - intersection);
      metrics.add(Metric.forLabel("IOU", modelName, entry.getKey(), iou));
      sum += iou;
    }
    if (!metrics.isEmpty()) {
      metrics.add(new Metric("mIOU", modelName, Map.of(), null, null, sum / metrics.size()));
    }
    return metrics;
  }

  private static Map<Label, Set<Long>> idsByLabel(List<LabeledAnnotation> rows) {
    Map<Label, Set<Long>> result =
        new TreeMap<>(Comparator.comparing(Label::key).thenComparing(Label::value));
    for (LabeledAnnotation row : rows) {
      result.computeIfAbsent(row.label(), l -> new HashSet<>()).add(row.annotationId());
    }
    return result;
  }

  private static long pixelSum(Set<Long> ids, Map<Long, Long> pixelCounts) {
    long sum = 0;
    for (Long id : ids) {
      sum += pixelCounts.getOrDefault(id, 0L);
    }
    return sum;
  }
}

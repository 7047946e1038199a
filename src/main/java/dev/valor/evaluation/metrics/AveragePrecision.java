package dev.valor.evaluation.metrics;

import dev.valor.schema.Label;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Object-detection average precision with greedy, score-ordered matching and 101-point interpolated
 * precision.
 */
public final class AveragePrecision {

  private static final int RECALL_POINTS = 101;

  private AveragePrecision() {
    // utility class
  }

  /** Pairwise IOU between a ground-truth and a predicted annotation. */
  public record Overlap(long groundTruthId, long predictionId, double iou) {}

  /**
   * Computes AP per grouper label and mAP per threshold, plus both averaged over all computed
   * thresholds. Only thresholds in {@code parameters.iouThresholdsToReturn()} are reported
   * individually. Labels without ground truths are not scored.
   *
   * @param modelName model the results are tagged with
   * @param groundTruths ground-truth rows, already grouped
   * @param predictions prediction rows, already grouped
   * @param overlaps non-zero IOUs between ground truths and predictions on the same datum
   * @param parameters detection parameters
   * @return the AP family of metrics
   */
  public static List<Metric> compute(
      String modelName,
      List<LabeledAnnotation> groundTruths,
      List<LabeledAnnotation> predictions,
      List<Overlap> overlaps,
      EvaluationParameters parameters) {
    Map<Long, Map<Long, Double>> iouByPrediction = new HashMap<>();
    for (Overlap overlap : overlaps) {
      iouByPrediction
          .computeIfAbsent(overlap.predictionId(), id -> new HashMap<>())
          .put(overlap.groundTruthId(), overlap.iou());
    }
    Map<Label, List<LabeledAnnotation>> truthsByLabel = byLabel(groundTruths);
    Map<Label, List<LabeledAnnotation>> predictionsByLabel = byLabel(predictions);

    List<Double> computed = parameters.iouThresholdsToCompute();
    List<Double> returned = parameters.iouThresholdsToReturn();
    List<Metric> metrics = new ArrayList<>();
    Map<Double, List<Double>> apsByThreshold = new LinkedHashMap<>();
    List<Double> averagedAps = new ArrayList<>();

    for (Map.Entry<Label, List<LabeledAnnotation>> entry : truthsByLabel.entrySet()) {
      Label label = entry.getKey();
      List<LabeledAnnotation> preds = predictionsByLabel.getOrDefault(label, List.of());
      double sum = 0.0;
      for (double threshold : computed) {
        double ap = averagePrecision(entry.getValue(), preds, iouByPrediction, threshold);
        apsByThreshold.computeIfAbsent(threshold, t -> new ArrayList<>()).add(ap);
        sum += ap;
        if (returned.contains(threshold)) {
          metrics.add(new Metric("AP", modelName, Map.of("iou", threshold), label, null, ap));
        }
      }
      if (!computed.isEmpty()) {
        double averaged = sum / computed.size();
        averagedAps.add(averaged);
        metrics.add(
            new Metric(
                "APAveragedOverIOUs", modelName, Map.of("ious", computed), label, null, averaged));
      }
    }

    List<Double> maps = new ArrayList<>();
    for (Map.Entry<Double, List<Double>> entry : apsByThreshold.entrySet()) {
      double map = mean(entry.getValue());
      maps.add(map);
      if (returned.contains(entry.getKey())) {
        metrics.add(new Metric("mAP", modelName, Map.of("iou", entry.getKey()), null, null, map));
      }
    }
    if (!averagedAps.isEmpty()) {
      metrics.add(
          new Metric(
              "mAPAveragedOverIOUs", modelName, Map.of("ious", computed), null, null, mean(maps)));
    }
    return metrics;
  }

  /**
   * AP of one label at one IOU threshold.
   *
   * @return the interpolated AP, 0 when there are ground truths but no predictions
   */
  static double averagePrecision(
      List<LabeledAnnotation> truths,
      List<LabeledAnnotation> predictions,
      Map<Long, Map<Long, Double>> iouByPrediction,
      double threshold) {
    Set<Long> truthIds = new HashSet<>();
    truths.forEach(truth -> truthIds.add(truth.annotationId()));
    if (truthIds.isEmpty()) {
      return Metric.UNDEFINED;
    }

    List<LabeledAnnotation> ordered = new ArrayList<>(predictions);
    ordered.sort(
        Comparator.comparingDouble(LabeledAnnotation::scoreOrZero)
            .reversed()
            .thenComparingLong(LabeledAnnotation::annotationId));

    Set<Long> matched = new HashSet<>();
    double[] precisions = new double[ordered.size()];
    double[] recalls = new double[ordered.size()];
    int tp = 0;
    for (int i = 0; i < ordered.size(); i++) {
      Map<Long, Double> candidates =
          iouByPrediction.getOrDefault(ordered.get(i).annotationId(), Map.of());
      Long best = null;
      double bestIou = -1.0;
      for (Map.Entry<Long, Double> candidate : new TreeMap<>(candidates).entrySet()) {
        long truthId = candidate.getKey();
        if (!truthIds.contains(truthId) || matched.contains(truthId)) {
          continue;
        }
        if (candidate.getValue() >= threshold && candidate.getValue() > bestIou) {
          best = truthId;
          bestIou = candidate.getValue();
        }
      }
      if (best != null) {
        matched.add(best);
        tp++;
      }
      precisions[i] = (double) tp / (i + 1);
      recalls[i] = (double) tp / truthIds.size();
    }

    double sum = 0.0;
    for (int point = 0; point < RECALL_POINTS; point++) {
      double recall = point / (double) (RECALL_POINTS - 1);
      double best = 0.0;
      for (int i = 0; i < precisions.length; i++) {
        if (recalls[i] >= recall - 1e-12 && precisions[i] > best) {
          best = precisions[i];
        }
      }
      sum += best;
    }
    return sum / RECALL_POINTS;
  }

  private static Map<Label, List<LabeledAnnotation>> byLabel(List<LabeledAnnotation> rows) {
    Map<Label, List<LabeledAnnotation>> result =
        new TreeMap<>(Comparator.comparing(Label::key).thenComparing(Label::value));
    for (LabeledAnnotation row : rows) {
      result.computeIfAbsent(row.label(), l -> new ArrayList<>()).add(row);
    }
    return result;
  }

  private static double mean(List<Double> values) {
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return values.isEmpty() ? Metric.UNDEFINED : sum / values.size();
  }
}

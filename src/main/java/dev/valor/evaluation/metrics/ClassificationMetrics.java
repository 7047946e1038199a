package dev.valor.evaluation.metrics;

import dev.valor.schema.Label;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * Classification scoring over grouped labels. Each datum carries at most one ground-truth value per
 * grouper key; its predicted value is the highest-scoring grouper value for that key.
 */
public final class ClassificationMetrics {

  private ClassificationMetrics() {
    // utility class
  }

  /**
   * Scores one model.
   *
   * @param modelName model the results are tagged with
   * @param groundTruths ground-truth rows
   * @param predictions prediction rows with scores
   * @param mappings grouper mapping applied to both sides
   * @return accuracy and ROC-AUC per key, precision/recall/F1 per label, a confusion matrix per key
   */
  public static MetricResults compute(
      String modelName,
      List<LabeledAnnotation> groundTruths,
      List<LabeledAnnotation> predictions,
      GrouperMappings mappings) {
    // key -> datum -> ground-truth value
    Map<String, Map<Long, String>> truthByKey = new TreeMap<>();
    for (LabeledAnnotation row : groundTruths) {
      Label grouper = mappings.grouperOf(row.label());
      truthByKey
          .computeIfAbsent(grouper.key(), k -> new TreeMap<>())
          .merge(row.datumId(), grouper.value(), (a, b) -> a.compareTo(b) <= 0 ? a : b);
    }
    // key -> datum -> value -> score
    Map<String, Map<Long, Map<String, Double>>> scoresByKey = new HashMap<>();
    for (LabeledAnnotation row : predictions) {
      Label grouper = mappings.grouperOf(row.label());
      scoresByKey
          .computeIfAbsent(grouper.key(), k -> new HashMap<>())
          .computeIfAbsent(row.datumId(), d -> new HashMap<>())
          .merge(grouper.value(), row.scoreOrZero(), Math::max);
    }

    List<Metric> metrics = new ArrayList<>();
    List<ConfusionMatrix> matrices = new ArrayList<>();
    for (Map.Entry<String, Map<Long, String>> entry : truthByKey.entrySet()) {
      String key = entry.getKey();
      Map<Long, String> truths = entry.getValue();
      Map<Long, Map<String, Double>> scores = scoresByKey.getOrDefault(key, Map.of());

      Map<Long, String> predicted = new HashMap<>();
      for (Long datumId : truths.keySet()) {
        String best = argmax(scores.getOrDefault(datumId, Map.of()));
        if (best != null) {
          predicted.put(datumId, best);
        }
      }

      int correct = 0;
      Map<String, Map<String, Integer>> cells = new TreeMap<>();
      for (Map.Entry<Long, String> truth : truths.entrySet()) {
        String prediction = predicted.get(truth.getKey());
        if (prediction == null) {
          continue;
        }
        if (prediction.equals(truth.getValue())) {
          correct++;
        }
        cells
            .computeIfAbsent(truth.getValue(), v -> new TreeMap<>())
            .merge(prediction, 1, Integer::sum);
      }
      metrics.add(Metric.forKey("Accuracy", modelName, key, (double) correct / truths.size()));
      metrics.add(Metric.forKey("ROCAUC", modelName, key, rocAuc(truths, scores)));

      TreeSet<String> values = new TreeSet<>(truths.values());
      values.addAll(predicted.values());
      for (String value : values) {
        addPrecisionRecall(metrics, modelName, new Label(key, value), truths, predicted);
      }

      List<ConfusionMatrix.Entry> entries = new ArrayList<>();
      cells.forEach(
          (truth, row) ->
              row.forEach(
                  (prediction, count) ->
                      entries.add(new ConfusionMatrix.Entry(truth, prediction, count))));
      matrices.add(new ConfusionMatrix(modelName, key, entries));
    }
    return new MetricResults(metrics, matrices);
  }

  private static void addPrecisionRecall(
      List<Metric> metrics,
      String modelName,
      Label label,
      Map<Long, String> truths,
      Map<Long, String> predicted) {
    int tp = 0;
    int fp = 0;
    int fn = 0;
    for (Map.Entry<Long, String> truth : truths.entrySet()) {
      boolean isPositive = truth.getValue().equals(label.value());
      boolean predictedPositive = label.value().equals(predicted.get(truth.getKey()));
      if (isPositive && predictedPositive) {
        tp++;
      } else if (predictedPositive) {
        fp++;
      } else if (isPositive) {
        fn++;
      }
    }
    double precision = tp + fp == 0 ? Metric.UNDEFINED : (double) tp / (tp + fp);
    double recall = tp + fn == 0 ? Metric.UNDEFINED : (double) tp / (tp + fn);
    double f1;
    if (precision == Metric.UNDEFINED || recall == Metric.UNDEFINED) {
      f1 = Metric.UNDEFINED;
    } else if (precision + recall == 0.0) {
      f1 = 0.0;
    } else {
      f1 = 2 * precision * recall / (precision + recall);
    }
    metrics.add(Metric.forLabel("Precision", modelName, label, precision));
    metrics.add(Metric.forLabel("Recall", modelName, label, recall));
    metrics.add(Metric.forLabel("F1", modelName, label, f1));
  }

  /** One-vs-rest ROC-AUC averaged over the values that have both positives and negatives. */
  static double rocAuc(Map<Long, String> truths, Map<Long, Map<String, Double>> scores) {
    double sum = 0.0;
    int counted = 0;
    for (String value : new TreeSet<>(truths.values())) {
      List<Double> positives = new ArrayList<>();
      List<Double> negatives = new ArrayList<>();
      for (Map.Entry<Long, String> truth : truths.entrySet()) {
        double score = scores.getOrDefault(truth.getKey(), Map.of()).getOrDefault(value, 0.0);
        if (truth.getValue().equals(value)) {
          positives.add(score);
        } else {
          negatives.add(score);
        }
      }
      if (positives.isEmpty() || negatives.isEmpty()) {
        continue;
      }
      sum += mannWhitney(positives, negatives);
      counted++;
    }
    return counted == 0 ? Metric.UNDEFINED : sum / counted;
  }

  /** Probability that a random positive outscores a random negative, ties counting half. */
  static double mannWhitney(List<Double> positives, List<Double> negatives) {
    double wins = 0.0;
    for (double positive : positives) {
      for (double negative : negatives) {
        if (positive > negative) {
          wins += 1.0;
        } else if (positive == negative) {
          wins += 0.5;
        }
      }
    }
    return wins / ((double) positives.size() * negatives.size());
  }

  private static @Nullable String argmax(Map<String, Double> scores) {
    String best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (String value : new TreeSet<>(scores.keySet())) {
      double score = scores.get(value);
      if (score > bestScore) {
        best = value;
        bestScore = score;
      }
    }
    return best;
  }
}

package dev.valor.evaluation.metrics;

import dev.valor.schema.Label;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Ranking scoring over grouped labels. A datum's ground truths are the values relevant to it; its
 * predictions, ordered by descending score, are the ranking a model returned for each key.
 */
public final class RankingMetrics {

  static final List<Integer> CUTOFFS = List.of(1, 3, 5);

  private static final Comparator<Map.Entry<String, Double>> BY_SCORE =
      Map.Entry.<String, Double>comparingByValue()
          .reversed()
          .thenComparing(Map.Entry::getKey);

  private RankingMetrics() {
    // utility class
  }

  /**
   * Scores one model.
   *
   * @param modelName model the results are tagged with
   * @param groundTruths relevant values per datum
   * @param predictions ranked values per datum, with scores
   * @param mappings grouper mapping applied to both sides
   * @return ROC-AUC, mean reciprocal rank and precision at 1, 3 and 5 per key
   */
  public static MetricResults compute(
      String modelName,
      List<LabeledAnnotation> groundTruths,
      List<LabeledAnnotation> predictions,
      GrouperMappings mappings) {
    // key -> datum -> relevant values
    Map<String, Map<Long, Set<String>>> relevantByKey = new TreeMap<>();
    for (LabeledAnnotation row : groundTruths) {
      Label grouper = mappings.grouperOf(row.label());
      relevantByKey
          .computeIfAbsent(grouper.key(), k -> new TreeMap<>())
          .computeIfAbsent(row.datumId(), d -> new HashSet<>())
          .add(grouper.value());
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
    for (Map.Entry<String, Map<Long, Set<String>>> entry : relevantByKey.entrySet()) {
      String key = entry.getKey();
      Map<Long, Set<String>> relevant = entry.getValue();
      Map<Long, List<String>> rankings = new HashMap<>();
      for (Long datumId : relevant.keySet()) {
        rankings.put(
            datumId,
            ranked(scoresByKey.getOrDefault(key, Map.of()).getOrDefault(datumId, Map.of())));
      }

      metrics.add(
          Metric.forKey(
              "ROCAUC", modelName, key, rocAuc(relevant, scoresByKey.getOrDefault(key, Map.of()))));
      metrics.add(Metric.forKey("MRR", modelName, key, meanReciprocalRank(relevant, rankings)));
      for (int k : CUTOFFS) {
        metrics.add(
            new Metric(
                "PrecisionAtK",
                modelName,
                Map.of("k", k),
                null,
                key,
                precisionAtK(relevant, rankings, k)));
      }
    }
    return new MetricResults(metrics, List.of());
  }

  static List<String> ranked(Map<String, Double> scores) {
    List<Map.Entry<String, Double>> entries = new ArrayList<>(scores.entrySet());
    entries.sort(BY_SCORE);
    List<String> values = new ArrayList<>(entries.size());
    entries.forEach(e -> values.add(e.getKey()));
    return values;
  }

  /** Mean over datums of {@code 1 / rank} of the first relevant value; 0 when none is ranked. */
  static double meanReciprocalRank(
      Map<Long, Set<String>> relevant, Map<Long, List<String>> rankings) {
    double sum = 0.0;
    for (Map.Entry<Long, Set<String>> entry : relevant.entrySet()) {
      List<String> ranking = rankings.getOrDefault(entry.getKey(), List.of());
      for (int i = 0; i < ranking.size(); i++) {
        if (entry.getValue().contains(ranking.get(i))) {
          sum += 1.0 / (i + 1);
          break;
        }
      }
    }
    return sum / relevant.size();
  }

  /** Mean over datums of the relevant share of the top {@code k} ranked values. */
  static double precisionAtK(
      Map<Long, Set<String>> relevant, Map<Long, List<String>> rankings, int k) {
    double sum = 0.0;
    for (Map.Entry<Long, Set<String>> entry : relevant.entrySet()) {
      List<String> ranking = rankings.getOrDefault(entry.getKey(), List.of());
      long hits =
          ranking.subList(0, Math.min(k, ranking.size())).stream()
              .filter(entry.getValue()::contains)
              .count();
      sum += (double) hits / k;
    }
    return sum / relevant.size();
  }

  /**
   * Pooled ROC-AUC: relevant values of every datum are positives, the other ranked values are
   * negatives. Relevant values the model left out score 0.
   */
  static double rocAuc(
      Map<Long, Set<String>> relevant, Map<Long, Map<String, Double>> scoresByDatum) {
    List<Double> positives = new ArrayList<>();
    List<Double> negatives = new ArrayList<>();
    for (Map.Entry<Long, Set<String>> entry : relevant.entrySet()) {
      Map<String, Double> scores = scoresByDatum.getOrDefault(entry.getKey(), Map.of());
      for (String value : entry.getValue()) {
        positives.add(scores.getOrDefault(value, 0.0));
      }
      scores.forEach(
          (value, score) -> {
            if (!entry.getValue().contains(value)) {
              negatives.add(score);
            }
          });
    }
    if (positives.isEmpty() || negatives.isEmpty()) {
      return Metric.UNDEFINED;
    }
    return ClassificationMetrics.mannWhitney(positives, negatives);
  }
}

package dev.valor.evaluation.metrics;

import java.util.ArrayList;
import java.util.List;

/** Metrics and confusion matrices produced for one model. */
public record MetricResults(List<Metric> metrics, List<ConfusionMatrix> confusionMatrices) {

  public MetricResults {
    metrics = List.copyOf(metrics);
    confusionMatrices = List.copyOf(confusionMatrices);
  }

  public static MetricResults empty() {
    return new MetricResults(List.of(), List.of());
  }

  /** Concatenation of this and {@code other}. */
  public MetricResults merge(MetricResults other) {
    List<Metric> allMetrics = new ArrayList<>(metrics);
    allMetrics.addAll(other.metrics);
    List<ConfusionMatrix> allMatrices = new ArrayList<>(confusionMatrices);
    allMatrices.addAll(other.confusionMatrices);
    return new MetricResults(allMetrics, allMatrices);
  }
}

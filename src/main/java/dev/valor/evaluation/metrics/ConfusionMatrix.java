package dev.valor.evaluation.metrics;

import java.util.List;

/**
 * Classification confusion matrix for one grouper key.
 *
 * @param modelName model the matrix belongs to
 * @param labelKey grouper key
 * @param entries non-zero cells
 */
public record ConfusionMatrix(String modelName, String labelKey, List<Entry> entries) {

  public ConfusionMatrix {
    entries = List.copyOf(entries);
  }

  /** Number of datums with ground truth {@code groundTruth} predicted as {@code prediction}. */
  public record Entry(String groundTruth, String prediction, int count) {}
}

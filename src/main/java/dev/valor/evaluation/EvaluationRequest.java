package dev.valor.evaluation;

import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.filter.FilterExpression;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * Request to evaluate one or more models.
 *
 * @param modelNames models to evaluate (non-empty; stored sorted and deduplicated)
 * @param datumFilter restricts the evaluated datums; null selects every datum
 * @param parameters task type, thresholds and label map
 * @param meta free-form metadata kept with the job, not part of its fingerprint
 */
public record EvaluationRequest(
    List<String> modelNames,
    @Nullable FilterExpression datumFilter,
    EvaluationParameters parameters,
    Map<String, Object> meta) {

  /** Compact constructor validating input. */
  public EvaluationRequest {
    if (modelNames == null || modelNames.isEmpty()) {
      throw new IllegalArgumentException("modelNames must not be empty");
    }
    for (String name : modelNames) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("modelNames must not contain blank names");
      }
    }
    if (parameters == null) {
      throw new IllegalArgumentException("parameters must not be null");
    }
    modelNames = List.copyOf(new TreeSet<>(modelNames));
    meta = meta == null ? Map.of() : Map.copyOf(meta);
  }

  /** Convenience constructor without metadata. */
  public EvaluationRequest(
      List<String> modelNames,
      @Nullable FilterExpression datumFilter,
      EvaluationParameters parameters) {
    this(modelNames, datumFilter, parameters, Map.of());
  }
}

package dev.valor.evaluation.metrics;

import dev.valor.filter.FilterExpression;
import dev.valor.schema.TaskType;
import org.jspecify.annotations.Nullable;

/** Computes the metrics of one task type for one model. */
public interface MetricComputer {

  TaskType taskType();

  /**
   * Computes metrics for {@code modelName} over the datums selected by {@code datumFilter}.
   *
   * @param modelName the evaluated model
   * @param datumFilter datum restriction, or null for every datum
   * @param parameters evaluation parameters
   * @return the computed metrics
   */
  MetricResults compute(
      String modelName, @Nullable FilterExpression datumFilter, EvaluationParameters parameters);
}

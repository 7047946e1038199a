package dev.valor.evaluation;

import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.MetricComputer;
import dev.valor.evaluation.metrics.MetricResults;
import dev.valor.filter.FilterExpression;
import dev.valor.schema.TaskType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs evaluation jobs on the {@code evaluationExecutor} pool.
 *
 * <p>Each run first claims the job through {@link EvaluationLifecycleService#start}; a run that
 * loses the claim does nothing. Failures during computation are logged and recorded on the job,
 * never rethrown.
 */
@Component
public class EvaluationWorker {

  private static final Logger log = LoggerFactory.getLogger(EvaluationWorker.class);

  private static final int MAX_ERROR_LENGTH = 1000;

  private final EvaluationLifecycleService lifecycleService;
  private final EvaluationCodec codec;
  private final Map<TaskType, MetricComputer> computers = new EnumMap<>(TaskType.class);
  private final TaskExecutor executor;

  public EvaluationWorker(
      EvaluationLifecycleService lifecycleService,
      EvaluationCodec codec,
      List<MetricComputer> computers,
      @Qualifier("evaluationExecutor") TaskExecutor executor) {
    this.lifecycleService = lifecycleService;
    this.codec = codec;
    for (MetricComputer computer : computers) {
      this.computers.put(computer.taskType(), computer);
    }
    this.executor = executor;
  }

  /** Hands the job to the pool. The caller never waits for the computation. */
  public void dispatch(UUID id) {
    try {
      executor.execute(() -> run(id));
    } catch (TaskRejectedException e) {
      log.warn("Evaluation {} not dispatched, pool is saturated: {}", id, e.getMessage());
    }
  }

  /** Re-dispatches jobs left pending by a previous run of the application. */
  @EventListener(ApplicationReadyEvent.class)
  public void dispatchPending() {
    List<Evaluation> pending = lifecycleService.findPending();
    if (!pending.isEmpty()) {
      log.info("Dispatching {} pending evaluation(s)", pending.size());
    }
    pending.forEach(evaluation -> dispatch(evaluation.getId()));
  }

  /** Claims, computes and completes one job. Extracted for testability. */
  void run(UUID id) {
    TransitionResult claim = lifecycleService.start(id);
    if (!claim.applied()) {
      return;
    }
    Evaluation evaluation = claim.evaluation();
    try {
      MetricResults results = compute(evaluation);
      lifecycleService.complete(id, results);
    } catch (RuntimeException e) {
      log.error("Evaluation {} failed: {}", id, e.getMessage(), e);
      lifecycleService.fail(id, summarize(e));
    }
  }

  private MetricResults compute(Evaluation evaluation) {
    EvaluationParameters parameters = codec.readParameters(evaluation.getParameters());
    @Nullable FilterExpression datumFilter = codec.readFilter(evaluation.getDatumFilter());
    MetricComputer computer = computers.get(parameters.taskType());
    if (computer == null) {
      throw new IllegalStateException(
          "No metric computer for task type " + parameters.taskType().value());
    }
    MetricResults results = MetricResults.empty();
    for (String modelName : codec.readModelNames(evaluation.getModelNames())) {
      results = results.merge(computer.compute(modelName, datumFilter, parameters));
    }
    return results;
  }

  static String summarize(RuntimeException e) {
    String message = e.getMessage() == null ? "" : ": " + e.getMessage();
    String summary = e.getClass().getSimpleName() + message;
    return summary.length() <= MAX_ERROR_LENGTH ? summary : summary.substring(0, MAX_ERROR_LENGTH);
  }
}

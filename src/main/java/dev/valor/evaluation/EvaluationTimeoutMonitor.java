package dev.valor.evaluation;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically reports jobs that have been running longer than the configured timeout. */
@Component
public class EvaluationTimeoutMonitor {

  private final EvaluationLifecycleService lifecycleService;
  private final EvaluationProperties properties;

  public EvaluationTimeoutMonitor(
      EvaluationLifecycleService lifecycleService, EvaluationProperties properties) {
    this.lifecycleService = lifecycleService;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${valor.evaluation.timeout-check-interval:PT1M}",
      initialDelayString = "${valor.evaluation.timeout-check-interval:PT1M}")
  public void sweep() {
    lifecycleService.failTimedOut(properties.getTimeout());
  }
}

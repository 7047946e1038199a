package dev.valor.evaluation;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for background evaluation.
 *
 * <p>Properties are bound from {@code valor.evaluation.*} in application.yml.
 *
 * <ul>
 *   <li>{@code worker-threads} - size of the evaluation pool (default 4, bounded [1, 64])
 *   <li>{@code queue-capacity} - jobs waiting for a free worker before dispatch is rejected
 *       (default 100)
 *   <li>{@code timeout} - running jobs older than this are reported as failed (default PT30M)
 *   <li>{@code timeout-check-interval} - delay between timeout sweeps (default PT1M)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "valor.evaluation")
public class EvaluationProperties {

  private int workerThreads = 4;
  private int queueCapacity = 100;
  private Duration timeout = Duration.ofMinutes(30);
  private Duration timeoutCheckInterval = Duration.ofMinutes(1);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (workerThreads < 1 || workerThreads > 64) {
      throw new IllegalStateException(
          "valor.evaluation.worker-threads must be in [1, 64], got: " + workerThreads);
    }
    if (queueCapacity < 1) {
      throw new IllegalStateException(
          "valor.evaluation.queue-capacity must be >= 1, got: " + queueCapacity);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException("valor.evaluation.timeout must be positive, got: " + timeout);
    }
    if (timeoutCheckInterval == null
        || timeoutCheckInterval.isNegative()
        || timeoutCheckInterval.isZero()) {
      throw new IllegalStateException(
          "valor.evaluation.timeout-check-interval must be positive, got: "
              + timeoutCheckInterval);
    }
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Duration getTimeoutCheckInterval() {
    return timeoutCheckInterval;
  }

  public void setTimeoutCheckInterval(Duration timeoutCheckInterval) {
    this.timeoutCheckInterval = timeoutCheckInterval;
  }
}

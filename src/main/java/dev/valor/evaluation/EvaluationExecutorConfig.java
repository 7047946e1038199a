package dev.valor.evaluation;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the bounded pool that runs evaluation jobs, and enables the scheduled timeout sweep.
 *
 * <p>Sized from {@link EvaluationProperties}. A full queue rejects the dispatch; the job stays
 * pending and is picked up again at the next application start.
 */
@Configuration
@EnableScheduling
public class EvaluationExecutorConfig {

  /**
   * Creates the executor used by {@link EvaluationWorker}.
   *
   * @param properties validated evaluation settings
   * @return a named executor bean, shut down with the application context
   */
  @Bean
  public ThreadPoolTaskExecutor evaluationExecutor(EvaluationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getWorkerThreads());
    executor.setMaxPoolSize(properties.getWorkerThreads());
    executor.setQueueCapacity(properties.getQueueCapacity());
    executor.setThreadNamePrefix("evaluation-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}

package dev.valor.evaluation;

import dev.valor.catalog.ModelNotFoundException;
import dev.valor.catalog.ModelRepository;
import dev.valor.evaluation.metrics.MetricResults;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates evaluation jobs and drives their state machine.
 *
 * <p>{@link #createOrGet} is idempotent per fingerprint, including under concurrent duplicates.
 * {@link #start} is the only serialization point: a conditional update lets exactly one worker move
 * a job from PENDING to RUNNING, and every other caller gets the stored job back unchanged.
 * {@link #complete} and {@link #fail} only apply to RUNNING jobs.
 */
@Service
public class EvaluationLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(EvaluationLifecycleService.class);

  static final String TIMED_OUT_MESSAGE = "timed out";

  private final EvaluationRepository evaluationRepository;
  private final ModelRepository modelRepository;
  private final EvaluationCodec codec;
  private final Clock clock;

  public EvaluationLifecycleService(
      EvaluationRepository evaluationRepository,
      ModelRepository modelRepository,
      EvaluationCodec codec,
      Clock clock) {
    this.evaluationRepository = evaluationRepository;
    this.modelRepository = modelRepository;
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Returns the job for the request's fingerprint, inserting a PENDING one if none exists.
   *
   * @param request the evaluation request
   * @return the job and whether this call created it
   * @throws ModelNotFoundException if a requested model is not registered
   * @throws dev.valor.filter.FilterCompilationException if the datum filter does not compile
   */
  public CreateResult createOrGet(EvaluationRequest request) {
    List<String> missing = new ArrayList<>(request.modelNames());
    missing.removeAll(modelRepository.findExistingNames(request.modelNames()));
    if (!missing.isEmpty()) {
      throw new ModelNotFoundException(missing);
    }

    String fingerprint = EvaluationFingerprint.of(request);
    int inserted =
        evaluationRepository.insertIfAbsent(
            fingerprint,
            codec.write(request.modelNames()),
            codec.writeFilter(request.datumFilter()),
            codec.write(request.parameters()),
            request.parameters().taskType().value(),
            codec.write(request.meta()),
            clock.instant());
    Evaluation evaluation =
        evaluationRepository
            .findByFingerprint(fingerprint)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Evaluation with fingerprint " + fingerprint + " vanished after insert"));
    if (inserted == 1) {
      log.info(
          "Created evaluation {} for models {} ({})",
          evaluation.getId(),
          request.modelNames(),
          request.parameters().taskType().value());
    } else {
      log.debug("Reusing evaluation {} with status {}", evaluation.getId(), evaluation.getStatus());
    }
    return new CreateResult(evaluation, inserted == 1);
  }

  /**
   * Claims a PENDING job for computation.
   *
   * @return the stored job, with {@code applied} true only for the caller that won the claim
   * @throws EvaluationNotFoundException if the job does not exist
   */
  public TransitionResult start(UUID id) {
    boolean applied = evaluationRepository.markRunning(id, clock.instant()) == 1;
    Evaluation evaluation = get(id);
    if (applied) {
      log.info("Evaluation {} is running", id);
    } else {
      log.debug("Evaluation {} not claimed, status is {}", id, evaluation.getStatus());
    }
    return new TransitionResult(evaluation, applied);
  }

  /**
   * Moves a RUNNING job to DONE with its results and elapsed time since it started.
   *
   * @return the stored job; {@code applied} is false if it was no longer RUNNING
   */
  public TransitionResult complete(UUID id, MetricResults results) {
    Instant now = clock.instant();
    Evaluation current = get(id);
    boolean applied =
        evaluationRepository.markDone(
                id,
                codec.write(results.metrics()),
                codec.write(results.confusionMatrices()),
                elapsedSeconds(current, now),
                now)
            == 1;
    return finish(id, applied, EvaluationStatus.DONE);
  }

  /**
   * Moves a RUNNING job to FAILED with an error summary.
   *
   * @return the stored job; {@code applied} is false if it was no longer RUNNING
   */
  public TransitionResult fail(UUID id, String errorMessage) {
    Instant now = clock.instant();
    Evaluation current = get(id);
    boolean applied =
        evaluationRepository.markFailed(id, errorMessage, elapsedSeconds(current, now), now) == 1;
    return finish(id, applied, EvaluationStatus.FAILED);
  }

  /**
   * Reports every job that has been RUNNING for longer than {@code timeout} as FAILED. Workers are
   * not interrupted; their later completion becomes a no-op.
   *
   * @return number of jobs marked as timed out
   */
  public int failTimedOut(Duration timeout) {
    Instant now = clock.instant();
    int count = evaluationRepository.markTimedOut(now.minus(timeout), TIMED_OUT_MESSAGE, now);
    if (count > 0) {
      log.warn("Marked {} evaluation(s) running longer than {} as failed", count, timeout);
    }
    return count;
  }

  /**
   * Current state of a job. Never blocks on computation.
   *
   * @throws EvaluationNotFoundException if the job does not exist
   */
  public Evaluation get(UUID id) {
    return evaluationRepository.findById(id).orElseThrow(() -> new EvaluationNotFoundException(id));
  }

  public List<Evaluation> listByModel(String modelName) {
    return evaluationRepository.findByModelName(modelName);
  }

  public List<Evaluation> findPending() {
    return evaluationRepository.findByStatusOrderByCreatedAtAsc(EvaluationStatus.PENDING);
  }

  private TransitionResult finish(UUID id, boolean applied, EvaluationStatus target) {
    Evaluation evaluation = get(id);
    if (applied) {
      log.info("Evaluation {} is {}", id, target);
    } else {
      log.warn(
          "Evaluation {} could not move to {}, status is {}", id, target, evaluation.getStatus());
    }
    return new TransitionResult(evaluation, applied);
  }

  private static double elapsedSeconds(Evaluation evaluation, Instant now) {
    Instant startedAt = evaluation.getStartedAt();
    if (startedAt == null) {
      return 0.0;
    }
    return Duration.between(startedAt, now).toMillis() / 1000.0;
  }
}

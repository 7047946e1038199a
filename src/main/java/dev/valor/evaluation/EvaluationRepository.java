package dev.valor.evaluation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/**
 * Spring Data repository for {@link Evaluation} jobs.
 *
 * <p>Every state change is a single conditional statement, so concurrent callers never need a lock:
 * the database decides which of them wins.
 */
public interface EvaluationRepository extends JpaRepository<Evaluation, UUID> {

  Optional<Evaluation> findByFingerprint(String fingerprint);

  List<Evaluation> findByStatusOrderByCreatedAtAsc(EvaluationStatus status);

  /**
   * Inserts a pending job unless one with the same fingerprint exists.
   *
   * @return 1 if a row was inserted, 0 if the fingerprint was already taken
   */
  @Modifying
  @Transactional
  @Query(
      value =
          """
            INSERT INTO evaluations (id, fingerprint, model_names, datum_filter, parameters,
                                     task_type, meta, status, created_at, updated_at)
            VALUES (gen_random_uuid(), :fingerprint, CAST(:modelNames AS jsonb),
                    CAST(:datumFilter AS jsonb), CAST(:parameters AS jsonb), :taskType,
                    CAST(:meta AS jsonb), 'PENDING', :now, :now)
            ON CONFLICT (fingerprint) DO NOTHING
            """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("fingerprint") String fingerprint,
      @Param("modelNames") String modelNames,
      @Param("datumFilter") String datumFilter,
      @Param("parameters") String parameters,
      @Param("taskType") String taskType,
      @Param("meta") String meta,
      @Param("now") Instant now);

  /**
   * Claims a pending job.
   *
   * @return 1 if this caller moved the job to RUNNING, 0 otherwise
   */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      """
        UPDATE Evaluation e
        SET e.status = dev.valor.evaluation.EvaluationStatus.RUNNING,
            e.startedAt = :now, e.updatedAt = :now
        WHERE e.id = :id AND e.status = dev.valor.evaluation.EvaluationStatus.PENDING
        """)
  int markRunning(@Param("id") UUID id, @Param("now") Instant now);

  /**
   * Attaches results to a running job.
   *
   * @return 1 if the job was RUNNING and is now DONE, 0 otherwise
   */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      value =
          """
            UPDATE evaluations
            SET status = 'DONE', metrics = CAST(:metrics AS jsonb),
                confusion_matrices = CAST(:confusionMatrices AS jsonb),
                duration_seconds = :durationSeconds, updated_at = :now
            WHERE id = :id AND status = 'RUNNING'
            """,
      nativeQuery = true)
  int markDone(
      @Param("id") UUID id,
      @Param("metrics") String metrics,
      @Param("confusionMatrices") String confusionMatrices,
      @Param("durationSeconds") double durationSeconds,
      @Param("now") Instant now);

  /**
   * Records the failure of a running job.
   *
   * @return 1 if the job was RUNNING and is now FAILED, 0 otherwise
   */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      """
        UPDATE Evaluation e
        SET e.status = dev.valor.evaluation.EvaluationStatus.FAILED,
            e.errorMessage = :errorMessage, e.durationSeconds = :durationSeconds,
            e.updatedAt = :now
        WHERE e.id = :id AND e.status = dev.valor.evaluation.EvaluationStatus.RUNNING
        """)
  int markFailed(
      @Param("id") UUID id,
      @Param("errorMessage") String errorMessage,
      @Param("durationSeconds") double durationSeconds,
      @Param("now") Instant now);

  /**
   * Fails every job that has been running since before {@code cutoff}.
   *
   * @return number of jobs marked as timed out
   */
  @Modifying(clearAutomatically = true)
  @Transactional
  @Query(
      """
        UPDATE Evaluation e
        SET e.status = dev.valor.evaluation.EvaluationStatus.FAILED,
            e.errorMessage = :errorMessage, e.updatedAt = :now
        WHERE e.status = dev.valor.evaluation.EvaluationStatus.RUNNING
          AND e.startedAt < :cutoff
        """)
  int markTimedOut(
      @Param("cutoff") Instant cutoff,
      @Param("errorMessage") String errorMessage,
      @Param("now") Instant now);

  /** Jobs whose model list contains {@code modelName}, newest first. */
  @Query(
      value =
          """
            SELECT * FROM evaluations
            WHERE model_names @> jsonb_build_array(CAST(:modelName AS text))
            ORDER BY created_at DESC
            """,
      nativeQuery = true)
  List<Evaluation> findByModelName(@Param("modelName") String modelName);
}

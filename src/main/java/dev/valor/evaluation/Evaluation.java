package dev.valor.evaluation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An evaluation job, unique per request fingerprint.
 *
 * <p>Rows are inserted and advanced only through the conditional statements of {@link
 * EvaluationRepository}; the entity itself is read-only from JPA's point of view. JSON-valued
 * columns are kept as raw JSONB text and decoded by {@link EvaluationCodec}.
 *
 * <p>Maps to the {@code evaluations} table managed by Flyway migrations.
 */
@Entity
@Table(name = "evaluations")
public class Evaluation {

  @Id private UUID id;

  @Column(nullable = false, unique = true, updatable = false)
  private String fingerprint;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "model_names", columnDefinition = "JSONB", nullable = false)
  private String modelNames;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "datum_filter", columnDefinition = "JSONB", nullable = false)
  private String datumFilter;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "parameters", columnDefinition = "JSONB", nullable = false)
  private String parameters;

  @Column(name = "task_type", nullable = false)
  private String taskType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "meta", columnDefinition = "JSONB", nullable = false)
  private String meta;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private EvaluationStatus status = EvaluationStatus.PENDING;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metrics", columnDefinition = "JSONB")
  private String metrics;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "confusion_matrices", columnDefinition = "JSONB")
  private String confusionMatrices;

  @Column(name = "error_message")
  private String errorMessage;

  @Column(name = "duration_seconds")
  private Double durationSeconds;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Evaluation() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getFingerprint() {
    return fingerprint;
  }

  public String getModelNames() {
    return modelNames;
  }

  public String getDatumFilter() {
    return datumFilter;
  }

  public String getParameters() {
    return parameters;
  }

  public String getTaskType() {
    return taskType;
  }

  public String getMeta() {
    return meta;
  }

  public EvaluationStatus getStatus() {
    return status;
  }

  public String getMetrics() {
    return metrics;
  }

  public String getConfusionMatrices() {
    return confusionMatrices;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Double getDurationSeconds() {
    return durationSeconds;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

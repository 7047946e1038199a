package dev.valor.api;

import com.fasterxml.jackson.databind.JsonNode;
import dev.valor.evaluation.Evaluation;
import dev.valor.evaluation.EvaluationCodec;
import dev.valor.evaluation.EvaluationStatus;
import dev.valor.evaluation.metrics.ConfusionMatrix;
import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.Metric;
import dev.valor.filter.FilterExpression;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** JSON view of an evaluation job. */
public record EvaluationResponse(
    UUID id,
    List<String> modelNames,
    @Nullable JsonNode datumFilter,
    EvaluationParameters parameters,
    Map<String, Object> meta,
    EvaluationStatus status,
    List<Metric> metrics,
    List<ConfusionMatrix> confusionMatrices,
    @Nullable String errorMessage,
    @Nullable Double durationSeconds,
    Instant createdAt,
    Instant updatedAt) {

  static EvaluationResponse from(Evaluation evaluation, EvaluationCodec codec) {
    FilterExpression filter = codec.readFilter(evaluation.getDatumFilter());
    return new EvaluationResponse(
        evaluation.getId(),
        codec.readModelNames(evaluation.getModelNames()),
        filter == null ? null : filter.toJson(),
        codec.readParameters(evaluation.getParameters()),
        codec.readMeta(evaluation.getMeta()),
        evaluation.getStatus(),
        codec.readMetrics(evaluation.getMetrics()),
        codec.readConfusionMatrices(evaluation.getConfusionMatrices()),
        evaluation.getErrorMessage(),
        evaluation.getDurationSeconds(),
        evaluation.getCreatedAt(),
        evaluation.getUpdatedAt());
  }
}

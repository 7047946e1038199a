package dev.valor.api;

import com.fasterxml.jackson.databind.JsonNode;
import dev.valor.evaluation.EvaluationRequest;
import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.filter.FilterParser;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /evaluations}.
 *
 * @param modelNames models to evaluate
 * @param datumFilter filter expression in its JSON form, or null for every datum
 * @param parameters evaluation parameters
 * @param meta free-form metadata
 */
public record EvaluationRequestBody(
    List<String> modelNames,
    @Nullable JsonNode datumFilter,
    EvaluationParameters parameters,
    @Nullable Map<String, Object> meta) {

  /**
   * Parses the filter and validates the request.
   *
   * @throws dev.valor.filter.FilterCompilationException if the filter is malformed
   * @throws IllegalArgumentException if the request is invalid
   */
  public EvaluationRequest toRequest() {
    return new EvaluationRequest(
        modelNames, FilterParser.parse(datumFilter), parameters, meta == null ? Map.of() : meta);
  }
}

package dev.valor.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.valor.evaluation.metrics.ConfusionMatrix;
import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.Metric;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterParser;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/** Converts between evaluation values and the JSONB text stored in {@code evaluations}. */
@Component
public class EvaluationCodec {

  private final ObjectMapper objectMapper;

  public EvaluationCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String writeFilter(@Nullable FilterExpression filter) {
    return filter == null ? "null" : filter.toJson().toString();
  }

  public @Nullable FilterExpression readFilter(@Nullable String json) {
    if (json == null) {
      return null;
    }
    try {
      return FilterParser.parse(objectMapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored datum filter is not valid JSON", e);
    }
  }

  public String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Cannot serialize " + value.getClass().getSimpleName() + " to JSON", e);
    }
  }

  public List<String> readModelNames(String json) {
    return read(json, new TypeReference<List<String>>() {});
  }

  public EvaluationParameters readParameters(String json) {
    return read(json, new TypeReference<EvaluationParameters>() {});
  }

  public Map<String, Object> readMeta(String json) {
    return read(json, new TypeReference<Map<String, Object>>() {});
  }

  /** Stored metrics, or an empty list while the job has none. */
  public List<Metric> readMetrics(@Nullable String json) {
    return json == null ? List.of() : read(json, new TypeReference<List<Metric>>() {});
  }

  /** Stored confusion matrices, or an empty list while the job has none. */
  public List<ConfusionMatrix> readConfusionMatrices(@Nullable String json) {
    return json == null ? List.of() : read(json, new TypeReference<List<ConfusionMatrix>>() {});
  }

  private <T> T read(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored evaluation column is not valid JSON", e);
    }
  }
}

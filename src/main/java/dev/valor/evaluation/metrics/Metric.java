package dev.valor.evaluation.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.valor.schema.Label;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One computed metric value.
 *
 * @param type metric name, e.g. {@code AP} or {@code Accuracy}
 * @param modelName model the value belongs to
 * @param parameters metric parameters such as the IOU threshold; may be empty
 * @param label grouper label for per-label metrics
 * @param labelKey grouper key for per-key metrics
 * @param value the metric value; {@code -1} when undefined for the data
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Metric(
    String type,
    String modelName,
    Map<String, Object> parameters,
    @Nullable Label label,
    @Nullable String labelKey,
    double value) {

  /** Value reported when a metric is undefined, e.g. precision without predictions. */
  public static final double UNDEFINED = -1.0;

  public Metric {
    parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
  }

  public static Metric forLabel(String type, String modelName, Label label, double value) {
    return new Metric(type, modelName, Map.of(), label, null, value);
  }

  public static Metric forKey(String type, String modelName, String labelKey, double value) {
    return new Metric(type, modelName, Map.of(), null, labelKey, value);
  }
}

package dev.valor.evaluation.metrics;

import dev.valor.schema.TaskType;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of an evaluation, part of its fingerprint.
 *
 * <p>IOU thresholds only apply to object detection. When omitted there, they default to {@code
 * 0.50..0.95} in steps of {@code 0.05} (computed) and {@code [0.5, 0.75]} (returned). Every
 * returned threshold must also be computed.
 *
 * @param taskType task type whose annotations are evaluated
 * @param iouThresholdsToCompute IOU thresholds at which average precision is computed
 * @param iouThresholdsToReturn subset of the computed thresholds reported individually
 * @param labelMap optional mapping of raw labels onto grouper labels
 */
public record EvaluationParameters(
    TaskType taskType,
    @Nullable List<Double> iouThresholdsToCompute,
    @Nullable List<Double> iouThresholdsToReturn,
    List<LabelMapping> labelMap) {

  static final List<Double> DEFAULT_IOUS_TO_COMPUTE =
      List.of(0.5, 0.55, 0.6, 0.65, 0.7, 0.75, 0.8, 0.85, 0.9, 0.95);
  static final List<Double> DEFAULT_IOUS_TO_RETURN = List.of(0.5, 0.75);

  /** Compact constructor validating input and filling detection defaults. */
  public EvaluationParameters {
    if (taskType == null) {
      throw new IllegalArgumentException("taskType must not be null");
    }
    if (taskType == TaskType.OBJECT_DETECTION) {
      if (iouThresholdsToCompute == null) {
        iouThresholdsToCompute = DEFAULT_IOUS_TO_COMPUTE;
        if (iouThresholdsToReturn == null) {
          iouThresholdsToReturn = DEFAULT_IOUS_TO_RETURN;
        }
      } else if (iouThresholdsToReturn == null) {
        iouThresholdsToReturn = List.of();
      }
      iouThresholdsToCompute = validThresholds(iouThresholdsToCompute, "iouThresholdsToCompute");
      iouThresholdsToReturn = validThresholds(iouThresholdsToReturn, "iouThresholdsToReturn");
      if (!iouThresholdsToCompute.containsAll(iouThresholdsToReturn)) {
        throw new IllegalArgumentException(
            "iouThresholdsToReturn must be a subset of iouThresholdsToCompute");
      }
    } else if (iouThresholdsToCompute != null || iouThresholdsToReturn != null) {
      throw new IllegalArgumentException(
          "IOU thresholds are only valid for task type " + TaskType.OBJECT_DETECTION.value());
    }
    labelMap = labelMap == null ? List.of() : List.copyOf(labelMap);
  }

  /** Parameters with no thresholds and no label map. */
  public static EvaluationParameters of(TaskType taskType) {
    return new EvaluationParameters(taskType, null, null, List.of());
  }

  private static List<Double> validThresholds(List<Double> thresholds, String field) {
    for (Double threshold : thresholds) {
      if (threshold == null || threshold <= 0.0 || threshold > 1.0) {
        throw new IllegalArgumentException(
            field + " must contain values in (0, 1], got " + threshold);
      }
    }
    return List.copyOf(thresholds);
  }
}

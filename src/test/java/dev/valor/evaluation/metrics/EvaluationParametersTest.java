package dev.valor.evaluation.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.valor.schema.Label;
import dev.valor.schema.TaskType;
import java.util.List;
import org.junit.jupiter.api.Test;

class EvaluationParametersTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void detectionDefaultsThresholds() {
    EvaluationParameters parameters = EvaluationParameters.of(TaskType.OBJECT_DETECTION);

    assertThat(parameters.iouThresholdsToCompute())
        .containsExactly(0.5, 0.55, 0.6, 0.65, 0.7, 0.75, 0.8, 0.85, 0.9, 0.95);
    assertThat(parameters.iouThresholdsToReturn()).containsExactly(0.5, 0.75);
  }

  @Test
  void explicitComputeWithoutReturnReturnsNothingIndividually() {
    EvaluationParameters parameters =
        new EvaluationParameters(TaskType.OBJECT_DETECTION, List.of(0.3, 0.6), null, List.of());

    assertThat(parameters.iouThresholdsToReturn()).isEmpty();
  }

  @Test
  void classificationHasNoThresholds() {
    EvaluationParameters parameters = EvaluationParameters.of(TaskType.CLASSIFICATION);

    assertThat(parameters.iouThresholdsToCompute()).isNull();
    assertThat(parameters.iouThresholdsToReturn()).isNull();
  }

  @Test
  void thresholdsOnClassificationAreRejected() {
    assertThatThrownBy(
            () ->
                new EvaluationParameters(
                    TaskType.CLASSIFICATION, List.of(0.5), List.of(0.5), List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("object-detection");
  }

  @Test
  void returnedThresholdMustBeComputed() {
    assertThatThrownBy(
            () ->
                new EvaluationParameters(
                    TaskType.OBJECT_DETECTION, List.of(0.5), List.of(0.75), List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("subset");
  }

  @Test
  void thresholdOutsideUnitIntervalIsRejected() {
    assertThatThrownBy(
            () ->
                new EvaluationParameters(
                    TaskType.OBJECT_DETECTION, List.of(0.0, 0.5), List.of(), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                new EvaluationParameters(TaskType.OBJECT_DETECTION, List.of(1.5), null, List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void deserializesWireFormWithLabelMapPairs() throws Exception {
    String json =
        """
        {"taskType":"classification",
         "labelMap":[[["class","siamese"],["class","cat"]],[["class","tabby"],["class","cat"]]]}
        """;

    EvaluationParameters parameters = mapper.readValue(json, EvaluationParameters.class);

    assertThat(parameters.taskType()).isEqualTo(TaskType.CLASSIFICATION);
    assertThat(parameters.labelMap())
        .containsExactly(
            new LabelMapping(new Label("class", "siamese"), new Label("class", "cat")),
            new LabelMapping(new Label("class", "tabby"), new Label("class", "cat")));
  }

  @Test
  void serializesLabelMapAsPairs() throws Exception {
    EvaluationParameters parameters =
        new EvaluationParameters(
            TaskType.CLASSIFICATION,
            null,
            null,
            List.of(new LabelMapping(new Label("k", "a"), new Label("k", "b"))));

    String json = mapper.writeValueAsString(parameters);

    assertThat(json).contains("\"labelMap\":[[[\"k\",\"a\"],[\"k\",\"b\"]]]");
    assertThat(mapper.readValue(json, EvaluationParameters.class)).isEqualTo(parameters);
  }
}

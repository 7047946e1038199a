package dev.valor.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.schema.TaskType;
import java.util.List;
import org.junit.jupiter.api.Test;

class EvaluationRequestTest {

  private static final EvaluationParameters CLASSIFICATION =
      EvaluationParameters.of(TaskType.CLASSIFICATION);

  @Test
  void modelNamesAreSortedAndDeduplicated() {
    EvaluationRequest request =
        new EvaluationRequest(List.of("m2", "m1", "m2"), null, CLASSIFICATION);

    assertThat(request.modelNames()).containsExactly("m1", "m2");
    assertThat(request.meta()).isEmpty();
  }

  @Test
  void emptyModelListIsRejected() {
    assertThatThrownBy(() -> new EvaluationRequest(List.of(), null, CLASSIFICATION))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("modelNames must not be empty");
  }

  @Test
  void blankModelNameIsRejected() {
    assertThatThrownBy(() -> new EvaluationRequest(List.of("m1", " "), null, CLASSIFICATION))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void missingParametersAreRejected() {
    assertThatThrownBy(() -> new EvaluationRequest(List.of("m1"), null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("parameters must not be null");
  }
}

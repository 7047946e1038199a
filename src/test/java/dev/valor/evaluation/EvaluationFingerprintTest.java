package dev.valor.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.LabelMapping;
import dev.valor.filter.Comparison;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterOperator;
import dev.valor.filter.FilterType;
import dev.valor.filter.Symbol;
import dev.valor.filter.SymbolName;
import dev.valor.filter.TypeMismatchException;
import dev.valor.filter.Value;
import dev.valor.schema.Label;
import dev.valor.schema.TaskType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationFingerprintTest {

  private static final EvaluationParameters CLASSIFICATION =
      EvaluationParameters.of(TaskType.CLASSIFICATION);

  private static FilterExpression datasetIs(String name) {
    return new Comparison(
        FilterOperator.EQ,
        Symbol.of(SymbolName.DATASET_NAME, FilterType.STRING),
        Value.of(FilterType.STRING, name));
  }

  @Test
  void identicalRequestsShareAFingerprint() {
    String first =
        EvaluationFingerprint.of(
            new EvaluationRequest(List.of("m1", "m2"), datasetIs("ds1"), CLASSIFICATION));
    String second =
        EvaluationFingerprint.of(
            new EvaluationRequest(List.of("m2", "m1"), datasetIs("ds1"), CLASSIFICATION));

    assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  void metadataDoesNotContribute() {
    String plain =
        EvaluationFingerprint.of(new EvaluationRequest(List.of("m1"), null, CLASSIFICATION));
    String tagged =
        EvaluationFingerprint.of(
            new EvaluationRequest(List.of("m1"), null, CLASSIFICATION, Map.of("run", 7)));

    assertThat(tagged).isEqualTo(plain);
  }

  @Test
  void filterModelsAndParametersEachContribute() {
    String base =
        EvaluationFingerprint.of(
            new EvaluationRequest(List.of("m1"), datasetIs("ds1"), CLASSIFICATION));

    assertThat(
            EvaluationFingerprint.of(
                new EvaluationRequest(List.of("m1"), datasetIs("ds2"), CLASSIFICATION)))
        .isNotEqualTo(base);
    assertThat(
            EvaluationFingerprint.of(
                new EvaluationRequest(List.of("m1", "m2"), datasetIs("ds1"), CLASSIFICATION)))
        .isNotEqualTo(base);
    assertThat(
            EvaluationFingerprint.of(
                new EvaluationRequest(
                    List.of("m1"),
                    datasetIs("ds1"),
                    EvaluationParameters.of(TaskType.SEMANTIC_SEGMENTATION))))
        .isNotEqualTo(base);
  }

  @Test
  void labelMapOrderDoesNotContribute() {
    LabelMapping a = new LabelMapping(new Label("k", "a"), new Label("k", "x"));
    LabelMapping b = new LabelMapping(new Label("k", "b"), new Label("k", "x"));

    String first =
        EvaluationFingerprint.of(
            new EvaluationRequest(
                List.of("m1"),
                null,
                new EvaluationParameters(TaskType.CLASSIFICATION, null, null, List.of(a, b))));
    String second =
        EvaluationFingerprint.of(
            new EvaluationRequest(
                List.of("m1"),
                null,
                new EvaluationParameters(TaskType.CLASSIFICATION, null, null, List.of(b, a))));

    assertThat(first).isEqualTo(second);
  }

  @Test
  void invalidFilterIsRejectedBeforeHashing() {
    FilterExpression invalid =
        new Comparison(
            FilterOperator.EQ,
            Symbol.of(SymbolName.DATASET_NAME, FilterType.STRING),
            Value.of(5L));

    assertThatThrownBy(
            () ->
                EvaluationFingerprint.of(
                    new EvaluationRequest(List.of("m1"), invalid, CLASSIFICATION)))
        .isInstanceOf(TypeMismatchException.class);
  }
}

package dev.valor.evaluation.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.valor.schema.Label;
import java.util.List;

/**
 * One entry of a label map: {@code label} is scored as if it were {@code grouper}. Serialized as
 * {@code [[key, value], [grouperKey, grouperValue]]}.
 */
public record LabelMapping(Label label, Label grouper) {

  public LabelMapping {
    if (label == null || grouper == null) {
      throw new IllegalArgumentException("A label mapping needs both a label and a grouper");
    }
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  static LabelMapping fromPairs(List<List<String>> pairs) {
    if (pairs == null || pairs.size() != 2) {
      throw new IllegalArgumentException(
          "A label mapping must be [[key, value], [grouperKey, grouperValue]]");
    }
    return new LabelMapping(toLabel(pairs.get(0)), toLabel(pairs.get(1)));
  }

  @JsonValue
  List<List<String>> toPairs() {
    return List.of(List.of(label.key(), label.value()), List.of(grouper.key(), grouper.value()));
  }

  private static Label toLabel(List<String> pair) {
    if (pair == null || pair.size() != 2) {
      throw new IllegalArgumentException("A label must be a [key, value] pair, got " + pair);
    }
    return new Label(pair.get(0), pair.get(1));
  }
}

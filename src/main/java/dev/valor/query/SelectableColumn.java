package dev.valor.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/** Output columns a planned query may select. */
public enum SelectableColumn {
  ANNOTATION_ID("annotation_id", "annotations.id", false),
  DATUM_ID("datum_id", "datums.id", true),
  DATUM_UID("datum_uid", "datums.uid", true),
  DATASET_ID("dataset_id", "datasets.id", true),
  DATASET_NAME("dataset_name", "datasets.name", true),
  MODEL_NAME("model_name", "models.name", false),
  LABEL_ID("label_id", "labels.id", false),
  LABEL_KEY("label_key", "labels.key", false),
  LABEL_VALUE("label_value", "labels.value", false),
  SCORE("score", null, false);

  private final String alias;
  private final @Nullable String expression;
  private final boolean datumLevel;

  SelectableColumn(String alias, @Nullable String expression, boolean datumLevel) {
    this.alias = alias;
    this.expression = expression;
    this.datumLevel = datumLevel;
  }

  @JsonValue
  public String alias() {
    return alias;
  }

  /** Whether the column is available when pivoting on datums. */
  public boolean isDatumLevel() {
    return datumLevel;
  }

  /** Select-list entry for this column, e.g. {@code datums.uid AS datum_uid}. */
  String selectSql(LinkTable link) {
    if (this == SCORE) {
      return link == LinkTable.PREDICTIONS
          ? "predictions.score AS score"
          : "CAST(NULL AS double precision) AS score";
    }
    return expression + " AS " + alias;
  }

  @JsonCreator
  public static SelectableColumn fromValue(String value) {
    for (SelectableColumn column : values()) {
      if (column.alias.equalsIgnoreCase(value)) {
        return column;
      }
    }
    throw new IllegalArgumentException("Invalid column: " + value);
  }
}

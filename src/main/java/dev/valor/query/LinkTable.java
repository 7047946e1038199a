package dev.valor.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Tables linking annotations to labels. Labels are only reachable through one of them. */
public enum LinkTable {
  GROUND_TRUTHS("groundtruth", "groundtruths"),
  PREDICTIONS("prediction", "predictions");

  private final String value;
  private final String table;

  LinkTable(String value, String table) {
    this.value = value;
    this.table = table;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public String table() {
    return table;
  }

  @JsonCreator
  public static LinkTable fromValue(String value) {
    for (LinkTable link : values()) {
      if (link.value.equalsIgnoreCase(value)) {
        return link;
      }
    }
    throw new IllegalArgumentException("Invalid link table: " + value);
  }
}

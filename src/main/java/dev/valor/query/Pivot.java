package dev.valor.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Granularity at which a planned query returns rows. */
public enum Pivot {
  ANNOTATION("annotation", "annotations"),
  DATUM("datum", "datums");

  private final String value;
  private final String table;

  Pivot(String value, String table) {
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
  public static Pivot fromValue(String value) {
    for (Pivot pivot : values()) {
      if (pivot.value.equalsIgnoreCase(value)) {
        return pivot;
      }
    }
    throw new IllegalArgumentException("Invalid pivot: " + value);
  }
}

package dev.valor.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Annotation task types. Stored in {@code annotations.task_type} by their wire value. */
public enum TaskType {
  CLASSIFICATION("classification"),
  OBJECT_DETECTION("object-detection"),
  SEMANTIC_SEGMENTATION("semantic-segmentation"),
  RANKING("ranking");

  private final String value;

  TaskType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static TaskType fromValue(String value) {
    for (TaskType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid task type: " + value);
  }

  /**
   * Case-insensitive lookup that returns {@code null} instead of throwing.
   *
   * @param value the wire value
   * @return the matching task type, or null when none matches
   */
  public static TaskType parseOrNull(String value) {
    for (TaskType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    return null;
  }
}

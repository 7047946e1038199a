package dev.valor.filter;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Registry of every attribute a filter may reference, with the entity that owns it, the column it
 * is stored in and the operator categories it supports.
 *
 * <p>Only the metadata attributes are dictionary-valued and accept a {@code key}.
 */
public enum SymbolName {
  DATASET_NAME(
      "dataset.name", OwnerEntity.DATASET, "name", FilterType.STRING, OperatorCategory.EQUATABLE),
  DATASET_METADATA("dataset.metadata", OwnerEntity.DATASET, "meta", FilterType.DICTIONARY),
  MODEL_NAME(
      "model.name", OwnerEntity.MODEL, "name", FilterType.STRING, OperatorCategory.EQUATABLE),
  MODEL_METADATA("model.metadata", OwnerEntity.MODEL, "meta", FilterType.DICTIONARY),
  DATUM_UID("datum.uid", OwnerEntity.DATUM, "uid", FilterType.STRING, OperatorCategory.EQUATABLE),
  DATUM_METADATA("datum.metadata", OwnerEntity.DATUM, "meta", FilterType.DICTIONARY),
  ANNOTATION_BOX(
      "annotation.box",
      OwnerEntity.ANNOTATION,
      "box",
      FilterType.BOX,
      OperatorCategory.SPATIAL,
      OperatorCategory.NULLABLE),
  ANNOTATION_POLYGON(
      "annotation.polygon",
      OwnerEntity.ANNOTATION,
      "polygon",
      FilterType.POLYGON,
      OperatorCategory.SPATIAL,
      OperatorCategory.NULLABLE),
  ANNOTATION_RASTER(
      "annotation.raster",
      OwnerEntity.ANNOTATION,
      "raster",
      FilterType.RASTER,
      OperatorCategory.SPATIAL,
      OperatorCategory.NULLABLE),
  ANNOTATION_EMBEDDING(
      "annotation.embedding", OwnerEntity.EMBEDDING, "value", FilterType.EMBEDDING),
  ANNOTATION_METADATA("annotation.metadata", OwnerEntity.ANNOTATION, "meta", FilterType.DICTIONARY),
  ANNOTATION_LABELS(
      "annotation.labels", OwnerEntity.LABEL, "id", FilterType.LABEL, OperatorCategory.EQUATABLE),
  ANNOTATION_TASK_TYPE(
      "annotation.task_type",
      OwnerEntity.ANNOTATION,
      "task_type",
      FilterType.TASK_TYPE,
      OperatorCategory.EQUATABLE),
  LABEL_KEY("label.key", OwnerEntity.LABEL, "key", FilterType.STRING, OperatorCategory.EQUATABLE),
  LABEL_VALUE(
      "label.value", OwnerEntity.LABEL, "value", FilterType.STRING, OperatorCategory.EQUATABLE);

  private final String value;
  private final OwnerEntity owner;
  private final String column;
  private final FilterType columnType;
  private final Set<OperatorCategory> categories;

  SymbolName(
      String value,
      OwnerEntity owner,
      String column,
      FilterType columnType,
      OperatorCategory... categories) {
    this.value = value;
    this.owner = owner;
    this.column = column;
    this.columnType = columnType;
    EnumSet<OperatorCategory> set = EnumSet.noneOf(OperatorCategory.class);
    Collections.addAll(set, categories);
    this.categories = Collections.unmodifiableSet(set);
  }

  @JsonValue
  public String value() {
    return value;
  }

  public OwnerEntity owner() {
    return owner;
  }

  /** Qualified storage column, e.g. {@code annotations.box}. */
  public String qualifiedColumn() {
    return owner.table() + "." + column;
  }

  /** Type of the stored column; a symbol without a key must declare exactly this dtype. */
  public FilterType columnType() {
    return columnType;
  }

  public Set<OperatorCategory> categories() {
    return categories;
  }

  public boolean supportsKey() {
    return columnType == FilterType.DICTIONARY;
  }

  /**
   * Resolves an attribute path such as {@code dataset.metadata}.
   *
   * @param value the symbol name from the filter document
   * @return the registered symbol
   * @throws UnknownSymbolException if the name is not registered
   */
  public static SymbolName fromValue(String value) {
    for (SymbolName name : values()) {
      if (name.value.equals(value)) {
        return name;
      }
    }
    throw new UnknownSymbolException("Unknown attribute '" + value + "'");
  }
}

package dev.valor.filter;

/** Tables that own filterable attributes. The table name doubles as its alias in compiled SQL. */
public enum OwnerEntity {
  DATASET("datasets"),
  MODEL("models"),
  DATUM("datums"),
  ANNOTATION("annotations"),
  EMBEDDING("embeddings"),
  LABEL("labels");

  private final String table;

  OwnerEntity(String table) {
    this.table = table;
  }

  public String table() {
    return table;
  }

  /** Qualified primary key reference, e.g. {@code datums.id}. */
  public String idColumn() {
    return table + ".id";
  }
}

package dev.valor.schema;

/**
 * A key/value label attached to annotations through the ground-truth or prediction link tables.
 *
 * @param key the label key, e.g. {@code "animal"}
 * @param value the label value, e.g. {@code "dog"}
 */
public record Label(String key, String value) {

  public Label {
    if (key == null || value == null) {
      throw new IllegalArgumentException("Label key and value must not be null");
    }
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}

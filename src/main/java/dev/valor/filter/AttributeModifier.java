package dev.valor.filter;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Derived scalars that can be taken from a spatial attribute before comparing it. */
public enum AttributeModifier {
  AREA(
      "area",
      EnumSet.of(
          FilterType.BOX, FilterType.POLYGON, FilterType.MULTIPOLYGON, FilterType.RASTER));

  private static final Set<OperatorCategory> CATEGORIES =
      Collections.unmodifiableSet(
          EnumSet.of(OperatorCategory.EQUATABLE, OperatorCategory.QUANTIFIABLE));

  private final String value;
  private final Set<FilterType> appliesTo;

  AttributeModifier(String value, Set<FilterType> appliesTo) {
    this.value = value;
    this.appliesTo = Collections.unmodifiableSet(appliesTo);
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Categories of the derived scalar, independent of the source attribute. */
  public Set<OperatorCategory> categories() {
    return CATEGORIES;
  }

  public boolean appliesTo(FilterType dtype) {
    return appliesTo.contains(dtype);
  }

  /**
   * Resolves a modifier name.
   *
   * @param value the attribute string from the filter document
   * @return the matching modifier
   * @throws UnknownSymbolException if no modifier has this name
   */
  public static AttributeModifier fromValue(String value) {
    for (AttributeModifier modifier : values()) {
      if (modifier.value.equals(value)) {
        return modifier;
      }
    }
    throw new UnknownSymbolException("Unknown attribute modifier '" + value + "'");
  }
}

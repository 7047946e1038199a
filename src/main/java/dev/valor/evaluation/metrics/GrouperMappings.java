package dev.valor.evaluation.metrics;

import dev.valor.schema.Label;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses raw labels onto the grouper labels they are scored as. Labels absent from the label map
 * are their own grouper.
 */
public final class GrouperMappings {

  private final Map<Label, Label> grouperByLabel;

  private GrouperMappings(Map<Label, Label> grouperByLabel) {
    this.grouperByLabel = grouperByLabel;
  }

  /**
   * Builds the mapping from a label map.
   *
   * @param labelMap mapping entries; a label listed twice keeps its last grouper
   * @return the grouper mapping
   */
  public static GrouperMappings of(List<LabelMapping> labelMap) {
    Map<Label, Label> grouperByLabel = new HashMap<>();
    for (LabelMapping mapping : labelMap) {
      grouperByLabel.put(mapping.label(), mapping.grouper());
    }
    return new GrouperMappings(grouperByLabel);
  }

  public Label grouperOf(Label label) {
    return grouperByLabel.getOrDefault(label, label);
  }
}

package dev.valor.evaluation.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import dev.valor.schema.Label;
import java.util.List;
import org.junit.jupiter.api.Test;

class GrouperMappingsTest {

  @Test
  void mappedLabelsCollapseOntoTheirGrouper() {
    Label cat = new Label("class", "cat");
    GrouperMappings mappings =
        GrouperMappings.of(
            List.of(
                new LabelMapping(new Label("class", "siamese"), cat),
                new LabelMapping(new Label("breed", "tabby"), cat)));

    assertThat(mappings.grouperOf(new Label("class", "siamese"))).isEqualTo(cat);
    assertThat(mappings.grouperOf(new Label("breed", "tabby"))).isEqualTo(cat);
  }

  @Test
  void unmappedLabelIsItsOwnGrouper() {
    GrouperMappings mappings = GrouperMappings.of(List.of());

    assertThat(mappings.grouperOf(new Label("class", "dog"))).isEqualTo(new Label("class", "dog"));
  }

  @Test
  void groupedRowKeepsIdsAndScore() {
    Label cat = new Label("class", "cat");
    GrouperMappings mappings =
        GrouperMappings.of(List.of(new LabelMapping(new Label("class", "siamese"), cat)));
    LabeledAnnotation row = new LabeledAnnotation(7, 3, new Label("class", "siamese"), 0.4);

    assertThat(row.grouped(mappings)).isEqualTo(new LabeledAnnotation(7, 3, cat, 0.4));
  }
}

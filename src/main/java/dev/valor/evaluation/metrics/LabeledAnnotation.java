package dev.valor.evaluation.metrics;

import dev.valor.schema.Label;
import org.jspecify.annotations.Nullable;

/**
 * One (annotation, label) row returned by a ground-truth or prediction query.
 *
 * @param annotationId annotation id
 * @param datumId datum the annotation belongs to
 * @param label the linked label
 * @param score prediction score, null for ground truths
 */
public record LabeledAnnotation(
    long annotationId, long datumId, Label label, @Nullable Double score) {

  /** Same row with its label replaced by its grouper. */
  LabeledAnnotation grouped(GrouperMappings mappings) {
    return new LabeledAnnotation(annotationId, datumId, mappings.grouperOf(label), score);
  }

  double scoreOrZero() {
    return score == null ? 0.0 : score;
  }
}

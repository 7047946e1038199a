package dev.valor.evaluation.metrics;

import dev.valor.filter.FilterExpression;
import dev.valor.schema.TaskType;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Classification metrics from the labels linked to classification annotations. */
@Component
public class ClassificationMetricComputer implements MetricComputer {

  private static final Logger log = LoggerFactory.getLogger(ClassificationMetricComputer.class);

  private final AnnotationQueries annotationQueries;

  public ClassificationMetricComputer(AnnotationQueries annotationQueries) {
    this.annotationQueries = annotationQueries;
  }

  @Override
  public TaskType taskType() {
    return TaskType.CLASSIFICATION;
  }

  @Override
  public MetricResults compute(
      String modelName, @Nullable FilterExpression datumFilter, EvaluationParameters parameters) {
    List<LabeledAnnotation> groundTruths =
        annotationQueries.groundTruths(datumFilter, TaskType.CLASSIFICATION);
    List<LabeledAnnotation> predictions =
        annotationQueries.predictions(datumFilter, modelName, TaskType.CLASSIFICATION);
    log.debug(
        "Classification for model {}: {} ground-truth rows, {} prediction rows",
        modelName,
        groundTruths.size(),
        predictions.size());
    return ClassificationMetrics.compute(
        modelName, groundTruths, predictions, GrouperMappings.of(parameters.labelMap()));
  }
}

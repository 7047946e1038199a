package dev.valor.evaluation.metrics;

import dev.valor.filter.FilterExpression;
import dev.valor.schema.TaskType;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Ranking metrics from the labels linked to ranking annotations. */
@Component
public class RankingMetricComputer implements MetricComputer {

  private static final Logger log = LoggerFactory.getLogger(RankingMetricComputer.class);

  private final AnnotationQueries annotationQueries;

  public RankingMetricComputer(AnnotationQueries annotationQueries) {
    this.annotationQueries = annotationQueries;
  }

  @Override
  public TaskType taskType() {
    return TaskType.RANKING;
  }

  @Override
  public MetricResults compute(
      String modelName, @Nullable FilterExpression datumFilter, EvaluationParameters parameters) {
    List<LabeledAnnotation> groundTruths =
        annotationQueries.groundTruths(datumFilter, TaskType.RANKING);
    List<LabeledAnnotation> predictions =
        annotationQueries.predictions(datumFilter, modelName, TaskType.RANKING);
    log.debug(
        "Ranking for model {}: {} relevant rows, {} ranked rows",
        modelName,
        groundTruths.size(),
        predictions.size());
    return RankingMetrics.compute(
        modelName, groundTruths, predictions, GrouperMappings.of(parameters.labelMap()));
  }
}

package dev.valor.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.valor.BaseIntegrationTest;
import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.Metric;
import dev.valor.schema.TaskType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Object-detection evaluation against PostGIS: one car matched exactly, one car missed, and one
 * prediction that overlaps its ground truth by a quarter.
 */
class DetectionEvaluationIT extends BaseIntegrationTest {

  @Autowired EvaluationLifecycleService lifecycleService;

  @Autowired EvaluationWorker worker;

  @Autowired EvaluationCodec codec;

  @BeforeEach
  void seedDetections() {
    long dataset = insertDataset("streets");
    long model = insertModel("yolo");
    long street1 = insertDatum(dataset, "street1", "{}");
    long street2 = insertDatum(dataset, "street2", "{}");

    insertGroundTruth(box(street1, null, 0, 0, 10, 10), label("class", "car"));
    insertPrediction(box(street1, model, 0, 0, 10, 10), label("class", "car"), 0.9);

    insertGroundTruth(box(street2, null, 0, 0, 10, 10), label("class", "car"));
    insertPrediction(box(street2, model, 5, 5, 15, 15), label("class", "car"), 0.8);
  }

  private long box(long datumId, Long modelId, int xmin, int ymin, int xmax, int ymax) {
    String geoJson =
        String.format(
            "{\"type\": \"Polygon\", \"coordinates\": [[[%d, %d], [%d, %d], [%d, %d], [%d, %d],"
                + " [%d, %d]]]}",
            xmin, ymin, xmax, ymin, xmax, ymax, xmin, ymax, xmin, ymin);
    return jdbcTemplate.queryForObject(
        "INSERT INTO annotations (datum_id, model_id, task_type, box)"
            + " VALUES (?, ?, 'object-detection', ST_GeomFromGeoJSON(?)) RETURNING id",
        Long.class,
        datumId,
        modelId,
        geoJson);
  }

  @Test
  void averagePrecisionReflectsMatchesAtEachThreshold() {
    EvaluationRequest request =
        new EvaluationRequest(
            List.of("yolo"),
            null,
            new EvaluationParameters(
                TaskType.OBJECT_DETECTION, List.of(0.1, 0.5), List.of(0.1, 0.5), List.of()));
    CreateResult created = lifecycleService.createOrGet(request);

    worker.run(created.evaluation().getId());

    Evaluation done = lifecycleService.get(created.evaluation().getId());
    assertThat(done.getStatus()).isEqualTo(EvaluationStatus.DONE);
    List<Metric> metrics = codec.readMetrics(done.getMetrics());
    // overlapping pair: intersection 25, union 175
    assertThat(mapAt(metrics, 0.1)).isCloseTo(1.0, within(1e-9));
    assertThat(mapAt(metrics, 0.5)).isCloseTo(0.5, within(0.02));
  }

  private static double mapAt(List<Metric> metrics, double iou) {
    return metrics.stream()
        .filter(m -> m.type().equals("mAP"))
        .filter(m -> ((Number) m.parameters().get("iou")).doubleValue() == iou)
        .findFirst()
        .orElseThrow()
        .value();
  }
}

package dev.valor.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.valor.BaseIntegrationTest;
import dev.valor.filter.FilterExpression;
import dev.valor.filter.FilterParser;
import dev.valor.filter.TypeMismatchException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Runs compiled filters against a seeded PostGIS database.
 *
 * <p>Fixture: dataset {@code ds1} with datums {@code img1} (height 10) and {@code img2} (height
 * "tall"), three ground-truth annotations on {@code img1} labelled {@code animal=cat}, {@code
 * color=red} and both {@code animal=dog, color=blue}, and one prediction of model {@code m1}.
 */
class FilterQueryIT extends BaseIntegrationTest {

  @Autowired FilterQueryService filterQueryService;

  @Autowired ObjectMapper objectMapper;

  long cat;
  long red;
  long dogAndBlue;
  long predicted;

  @BeforeEach
  void seed() {
    long dataset = insertDataset("ds1");
    long model = insertModel("m1");
    long img1 = insertDatum(dataset, "img1", "{\"height\": 10}");
    long img2 = insertDatum(dataset, "img2", "{\"height\": \"tall\"}");

    cat = insertAnnotation(img1, null, "classification", "{}");
    insertGroundTruth(cat, label("animal", "cat"));
    red = insertAnnotation(img1, null, "classification", "{}");
    insertGroundTruth(red, label("color", "red"));
    dogAndBlue = insertAnnotation(img1, null, "classification", "{}");
    insertGroundTruth(dogAndBlue, label("animal", "dog"));
    insertGroundTruth(dogAndBlue, label("color", "blue"));

    long unlabelled = insertAnnotation(img2, null, "classification", "{}");
    insertGroundTruth(unlabelled, label("shape", "round"));

    predicted = insertAnnotation(img1, model, "classification", "{}");
    insertPrediction(predicted, label("animal", "cat"), 0.8);
  }

  private FilterExpression filter(String json) throws Exception {
    return FilterParser.parse(objectMapper.readTree(json));
  }

  private List<Long> annotationIds(FilterExpression filter, LinkTable link) {
    return filterQueryService
        .select(filter, Pivot.ANNOTATION, link, List.of(SelectableColumn.ANNOTATION_ID))
        .stream()
        .map(row -> ((Number) row.get("annotation_id")).longValue())
        .toList();
  }

  @Test
  void labelKeySelectsOnlyAnnotationsCarryingThatKey() throws Exception {
    FilterExpression animal =
        filter(
            """
            {"op": "eq", "lhs": {"name": "label.key", "dtype": "string"},
             "rhs": {"type": "string", "value": "animal"}}
            """);

    assertThat(annotationIds(animal, LinkTable.GROUND_TRUTHS))
        .containsExactlyInAnyOrder(cat, dogAndBlue);
  }

  @Test
  void negationIsTheComplementOverAnnotations() throws Exception {
    FilterExpression notAnimal =
        filter(
            """
            {"op": "not", "arg": {"op": "eq", "lhs": {"name": "label.key", "dtype": "string"},
                                   "rhs": {"type": "string", "value": "animal"}}}
            """);

    assertThat(annotationIds(notAnimal, LinkTable.GROUND_TRUTHS)).doesNotContain(cat, dogAndBlue);
    assertThat(annotationIds(notAnimal, LinkTable.GROUND_TRUTHS)).contains(red);
  }

  @Test
  void labelsOfOneAnnotationAreMatchedTogether() throws Exception {
    FilterExpression dogAndBlueLabels =
        filter(
            """
            {"op": "and", "args": [
              {"op": "eq", "lhs": {"name": "annotation.labels", "dtype": "label"},
               "rhs": {"type": "label", "value": {"key": "animal", "value": "dog"}}},
              {"op": "eq", "lhs": {"name": "annotation.labels", "dtype": "label"},
               "rhs": {"type": "label", "value": {"key": "color", "value": "blue"}}}]}
            """);

    assertThat(annotationIds(dogAndBlueLabels, LinkTable.GROUND_TRUTHS))
        .containsExactly(dogAndBlue);
  }

  @Test
  void metadataOfTheWrongTypeDoesNotMatch() throws Exception {
    FilterExpression taller =
        filter(
            """
            {"op": "gt", "lhs": {"name": "datum.metadata", "key": "height", "dtype": "integer"},
             "rhs": {"type": "integer", "value": 5}}
            """);

    List<Map<String, Object>> rows =
        filterQueryService.select(
            taller, Pivot.DATUM, LinkTable.GROUND_TRUTHS, List.of(SelectableColumn.DATUM_UID));

    assertThat(rows).extracting(row -> row.get("datum_uid")).containsExactly("img1");
  }

  @Test
  void unparsableMetadataReadsAsNullInsteadOfFailingTheQuery() throws Exception {
    long dataset = insertDataset("captures");
    long good =
        insertDatum(
            dataset,
            "good",
            """
            {"captured": "2024-03-01T12:00:00Z",
             "roi": {"type": "Polygon", "coordinates": [[[0, 0], [4, 0], [4, 4], [0, 4], [0, 0]]]}}
            """);
    long bad =
        insertDatum(dataset, "bad", "{\"captured\": \"yesterday\", \"roi\": {\"a\": 1}}");
    for (long datum : List.of(good, bad)) {
      insertGroundTruth(
          insertAnnotation(datum, null, "classification", "{}"), label("scene", "street"));
    }

    FilterExpression capturedLater =
        filter(
            """
            {"op": "gt", "lhs": {"name": "datum.metadata", "key": "captured", "dtype": "datetime"},
             "rhs": {"type": "datetime", "value": "2024-01-01T00:00:00Z"}}
            """);
    FilterExpression roiHitsOrigin =
        filter(
            """
            {"op": "intersects",
             "lhs": {"name": "datum.metadata", "key": "roi", "dtype": "polygon"},
             "rhs": {"type": "polygon", "value": [[[1, 1], [2, 1], [2, 2], [1, 1]]]}}
            """);

    for (FilterExpression expression : List.of(capturedLater, roiHitsOrigin)) {
      List<Map<String, Object>> rows =
          filterQueryService.select(
              expression,
              Pivot.DATUM,
              LinkTable.GROUND_TRUTHS,
              List.of(SelectableColumn.DATUM_UID));
      assertThat(rows).extracting(row -> row.get("datum_uid")).containsExactly("good");
    }
  }

  @Test
  void modelNameSelectsItsPredictionsWithScores() throws Exception {
    FilterExpression m1 =
        filter(
            """
            {"op": "eq", "lhs": {"name": "model.name", "dtype": "string"},
             "rhs": {"type": "string", "value": "m1"}}
            """);

    List<Map<String, Object>> rows =
        filterQueryService.select(
            m1,
            Pivot.ANNOTATION,
            LinkTable.PREDICTIONS,
            List.of(SelectableColumn.ANNOTATION_ID, SelectableColumn.SCORE));

    assertThat(rows).hasSize(1);
    assertThat(((Number) rows.get(0).get("annotation_id")).longValue()).isEqualTo(predicted);
    assertThat(((Number) rows.get(0).get("score")).doubleValue()).isEqualTo(0.8);
  }

  @Test
  void missingFilterSelectsEveryDatum() {
    List<Map<String, Object>> rows =
        filterQueryService.select(
            null, Pivot.DATUM, LinkTable.GROUND_TRUTHS, List.of(SelectableColumn.DATUM_UID));

    assertThat(rows).extracting(row -> row.get("datum_uid")).containsExactlyInAnyOrder(
        "img1", "img2");
  }

  @Test
  void rasterAreaCountsPixels() throws Exception {
    long datum = insertDatum(insertDataset("seg"), "mask-img", "{}");
    long large = rasterAnnotation(datum, 20, 10);
    long small = rasterAnnotation(datum, 5, 5);
    long none = insertAnnotation(datum, null, "semantic-segmentation", "{}");
    insertGroundTruth(none, label("class", "road"));

    FilterExpression largeMasks =
        filter(
            """
            {"op": "and", "args": [
              {"op": "isnotnull", "arg": {"name": "annotation.raster", "dtype": "raster"}},
              {"op": "gt", "lhs": {"name": "annotation.raster", "dtype": "raster",
                                   "attribute": "area"},
               "rhs": {"type": "integer", "value": 100}}]}
            """);

    assertThat(annotationIds(largeMasks, LinkTable.GROUND_TRUTHS)).containsExactly(large);
    assertThat(annotationIds(largeMasks, LinkTable.GROUND_TRUTHS)).doesNotContain(small, none);
  }

  @Test
  void boxInsideRegionUsesGeometryCoverage() throws Exception {
    long datum = insertDatum(insertDataset("det"), "street", "{}");
    long near = boxAnnotation(datum, 1, 1, 3, 3);
    long far = boxAnnotation(datum, 20, 20, 30, 30);

    FilterExpression insideRegion =
        filter(
            """
            {"op": "inside", "lhs": {"name": "annotation.box", "dtype": "box"},
             "rhs": {"type": "box",
                     "value": [[[0, 0], [10, 0], [10, 10], [0, 10], [0, 0]]]}}
            """);

    assertThat(annotationIds(insideRegion, LinkTable.GROUND_TRUTHS)).containsExactly(near);
    assertThat(annotationIds(insideRegion, LinkTable.GROUND_TRUTHS)).doesNotContain(far);
  }

  @Test
  void typeMismatchNeverReachesTheDatabase() {
    assertThatThrownBy(
            () ->
                filterQueryService.select(
                    filter(
                        """
                        {"op": "eq", "lhs": {"name": "datum.uid", "dtype": "string"},
                         "rhs": {"type": "integer", "value": 3}}
                        """),
                    Pivot.DATUM,
                    LinkTable.GROUND_TRUTHS,
                    List.of(SelectableColumn.DATUM_UID)))
        .isInstanceOf(TypeMismatchException.class);
  }

  private long rasterAnnotation(long datumId, int width, int height) {
    long id =
        jdbcTemplate.queryForObject(
            "INSERT INTO annotations (datum_id, task_type, raster) VALUES (?,"
                + " 'semantic-segmentation', ST_AddBand(ST_MakeEmptyRaster(?, ?, 0, 0, 1, -1, 0,"
                + " 0, 0), '1BB'::text, 1, 0)) RETURNING id",
            Long.class,
            datumId,
            width,
            height);
    insertGroundTruth(id, label("class", "road"));
    return id;
  }

  private long boxAnnotation(long datumId, int xmin, int ymin, int xmax, int ymax) {
    String geoJson =
        String.format(
            "{\"type\": \"Polygon\", \"coordinates\": [[[%d, %d], [%d, %d], [%d, %d], [%d, %d],"
                + " [%d, %d]]]}",
            xmin, ymin, xmax, ymin, xmax, ymax, xmin, ymax, xmin, ymin);
    long id =
        jdbcTemplate.queryForObject(
            "INSERT INTO annotations (datum_id, task_type, box)"
                + " VALUES (?, 'object-detection', ST_GeomFromGeoJSON(?)) RETURNING id",
            Long.class,
            datumId,
            geoJson);
    insertGroundTruth(id, label("class", "car"));
    return id;
  }
}

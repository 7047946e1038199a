package dev.valor;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with PostGIS and raster support, and
 * empties every table before each test so fixtures written through {@link #jdbcTemplate} never
 * leak between tests.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("postgis/postgis:16-3.4").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanDatabase() {
    jdbcTemplate.execute(
        "TRUNCATE evaluations, predictions, groundtruths, labels, annotations, embeddings,"
            + " datums, models, datasets RESTART IDENTITY CASCADE");
  }

  protected long insertDataset(String name) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO datasets (name) VALUES (?) RETURNING id", Long.class, name);
  }

  protected long insertModel(String name) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO models (name) VALUES (?) RETURNING id", Long.class, name);
  }

  protected long insertDatum(long datasetId, String uid, String metaJson) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO datums (dataset_id, uid, meta) VALUES (?, ?, CAST(? AS jsonb)) RETURNING id",
        Long.class,
        datasetId,
        uid,
        metaJson);
  }

  /** Inserts an annotation; {@code modelId} null makes it a ground truth. */
  protected long insertAnnotation(long datumId, Long modelId, String taskType, String metaJson) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO annotations (datum_id, model_id, task_type, meta)"
            + " VALUES (?, ?, ?, CAST(? AS jsonb)) RETURNING id",
        Long.class,
        datumId,
        modelId,
        taskType,
        metaJson);
  }

  protected long label(String key, String value) {
    return jdbcTemplate.queryForObject(
        "INSERT INTO labels (key, value) VALUES (?, ?)"
            + " ON CONFLICT (key, value) DO UPDATE SET key = EXCLUDED.key RETURNING id",
        Long.class,
        key,
        value);
  }

  protected void insertGroundTruth(long annotationId, long labelId) {
    jdbcTemplate.update(
        "INSERT INTO groundtruths (annotation_id, label_id) VALUES (?, ?)", annotationId, labelId);
  }

  protected void insertPrediction(long annotationId, long labelId, double score) {
    jdbcTemplate.update(
        "INSERT INTO predictions (annotation_id, label_id, score) VALUES (?, ?, ?)",
        annotationId,
        labelId,
        score);
  }
}

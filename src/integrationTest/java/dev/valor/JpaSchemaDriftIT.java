package dev.valor;

import static org.assertj.core.api.Assertions.assertThat;

import dev.valor.catalog.Dataset;
import dev.valor.catalog.DatasetRepository;
import dev.valor.catalog.Model;
import dev.valor.catalog.ModelRepository;
import dev.valor.evaluation.Evaluation;
import dev.valor.evaluation.EvaluationRepository;
import dev.valor.evaluation.EvaluationStatus;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity can be persisted (or inserted through
 * its conditional statement) and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private DatasetRepository datasetRepository;

  @Autowired private ModelRepository modelRepository;

  @Autowired private EvaluationRepository evaluationRepository;

  @Test
  void datasetEntityRoundtripsAgainstFlywaySchema() {
    Dataset saved = datasetRepository.saveAndFlush(new Dataset("ds1", "{\"split\": \"train\"}"));
    Dataset found = datasetRepository.findByName("ds1").orElseThrow();

    assertThat(found.getId()).isEqualTo(saved.getId());
    assertThat(found.getMeta()).contains("train");
    assertThat(found.getCreatedAt()).isNotNull();
  }

  @Test
  void modelEntityRoundtripsAgainstFlywaySchema() {
    modelRepository.saveAndFlush(new Model("m1", "{}"));
    modelRepository.saveAndFlush(new Model("m2", "{}"));

    assertThat(modelRepository.findByName("m1")).isPresent();
    assertThat(modelRepository.findExistingNames(List.of("m1", "m2", "ghost")))
        .containsExactlyInAnyOrder("m1", "m2");
  }

  @Test
  void evaluationEntityReadableAfterConditionalInsert() {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
    int inserted =
        evaluationRepository.insertIfAbsent(
            "a".repeat(64),
            "[\"m1\"]",
            "null",
            "{\"taskType\": \"classification\", \"labelMap\": []}",
            "classification",
            "{}",
            now);

    Evaluation found = evaluationRepository.findByFingerprint("a".repeat(64)).orElseThrow();

    assertThat(inserted).isEqualTo(1);
    assertThat(found.getId()).isNotNull();
    assertThat(found.getStatus()).isEqualTo(EvaluationStatus.PENDING);
    assertThat(found.getModelNames()).contains("m1");
    assertThat(found.getTaskType()).isEqualTo("classification");
    assertThat(found.getCreatedAt()).isEqualTo(now);
    assertThat(found.getStartedAt()).isNull();
    assertThat(found.getMetrics()).isNull();
  }
}

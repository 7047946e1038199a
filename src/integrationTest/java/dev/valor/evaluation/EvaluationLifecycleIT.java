package dev.valor.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.valor.BaseIntegrationTest;
import dev.valor.catalog.ModelNotFoundException;
import dev.valor.evaluation.metrics.EvaluationParameters;
import dev.valor.evaluation.metrics.Metric;
import dev.valor.evaluation.metrics.MetricResults;
import dev.valor.schema.TaskType;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class EvaluationLifecycleIT extends BaseIntegrationTest {

  @Autowired EvaluationLifecycleService lifecycleService;

  @Autowired EvaluationWorker worker;

  @Autowired EvaluationCodec codec;

  @Autowired EvaluationRepository evaluationRepository;

  private final EvaluationRequest request =
      new EvaluationRequest(List.of("m1"), null, EvaluationParameters.of(TaskType.CLASSIFICATION));

  @BeforeEach
  void seedClassification() {
    long dataset = insertDataset("ds1");
    long model = insertModel("m1");
    long img1 = insertDatum(dataset, "img1", "{}");
    long img2 = insertDatum(dataset, "img2", "{}");

    insertGroundTruth(insertAnnotation(img1, null, "classification", "{}"), label("class", "cat"));
    insertGroundTruth(insertAnnotation(img2, null, "classification", "{}"), label("class", "dog"));

    long first = insertAnnotation(img1, model, "classification", "{}");
    insertPrediction(first, label("class", "cat"), 0.9);
    insertPrediction(first, label("class", "dog"), 0.1);
    long second = insertAnnotation(img2, model, "classification", "{}");
    insertPrediction(second, label("class", "cat"), 0.6);
    insertPrediction(second, label("class", "dog"), 0.4);
  }

  @Test
  void concurrentDuplicateRequestsConvergeOnOneJob() throws Exception {
    CountDownLatch ready = new CountDownLatch(2);
    CountDownLatch go = new CountDownLatch(1);
    Callable<CreateResult> create =
        () -> {
          ready.countDown();
          go.await();
          return lifecycleService.createOrGet(request);
        };
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<CreateResult> first = pool.submit(create);
      Future<CreateResult> second = pool.submit(create);
      ready.await();
      go.countDown();

      CreateResult a = first.get(30, TimeUnit.SECONDS);
      CreateResult b = second.get(30, TimeUnit.SECONDS);

      assertThat(a.evaluation().getId()).isEqualTo(b.evaluation().getId());
      assertThat(List.of(a.created(), b.created())).containsExactlyInAnyOrder(true, false);
      assertThat(evaluationRepository.count()).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void unknownModelCreatesNoJob() {
    EvaluationRequest ghost =
        new EvaluationRequest(
            List.of("ghost"), null, EvaluationParameters.of(TaskType.CLASSIFICATION));

    assertThatThrownBy(() -> lifecycleService.createOrGet(ghost))
        .isInstanceOf(ModelNotFoundException.class);
    assertThat(evaluationRepository.count()).isZero();
  }

  @Test
  void onlyOneCallerClaimsAPendingJob() {
    CreateResult created = lifecycleService.createOrGet(request);

    TransitionResult first = lifecycleService.start(created.evaluation().getId());
    TransitionResult second = lifecycleService.start(created.evaluation().getId());

    assertThat(first.applied()).isTrue();
    assertThat(first.evaluation().getStatus()).isEqualTo(EvaluationStatus.RUNNING);
    assertThat(first.evaluation().getStartedAt()).isNotNull();
    assertThat(second.applied()).isFalse();
    assertThat(second.evaluation().getStatus()).isEqualTo(EvaluationStatus.RUNNING);
  }

  @Test
  void pendingJobCannotFinishWithoutBeingClaimed() {
    CreateResult created = lifecycleService.createOrGet(request);
    UUID id = created.evaluation().getId();

    TransitionResult completed = lifecycleService.complete(id, MetricResults.empty());
    TransitionResult failed = lifecycleService.fail(id, "IllegalStateException: boom");

    assertThat(completed.applied()).isFalse();
    assertThat(failed.applied()).isFalse();
    Evaluation stored = evaluationRepository.findById(id).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(EvaluationStatus.PENDING);
    assertThat(stored.getErrorMessage()).isNull();
    assertThat(stored.getMetrics()).isNull();
  }

  @Test
  void timedOutJobIgnoresLateCompletion() {
    CreateResult created = lifecycleService.createOrGet(request);
    lifecycleService.start(created.evaluation().getId());

    int timedOut = lifecycleService.failTimedOut(Duration.ofNanos(1));
    TransitionResult late =
        lifecycleService.complete(created.evaluation().getId(), MetricResults.empty());

    assertThat(timedOut).isEqualTo(1);
    assertThat(late.applied()).isFalse();
    assertThat(late.evaluation().getStatus()).isEqualTo(EvaluationStatus.FAILED);
    assertThat(late.evaluation().getErrorMessage()).isEqualTo("timed out");
  }

  @Test
  void workerComputesClassificationMetrics() {
    CreateResult created = lifecycleService.createOrGet(request);

    worker.run(created.evaluation().getId());

    Evaluation done = lifecycleService.get(created.evaluation().getId());
    assertThat(done.getStatus()).isEqualTo(EvaluationStatus.DONE);
    assertThat(done.getDurationSeconds()).isNotNull();
    List<Metric> metrics = codec.readMetrics(done.getMetrics());
    Metric accuracy =
        metrics.stream().filter(m -> m.type().equals("Accuracy")).findFirst().orElseThrow();
    assertThat(accuracy.modelName()).isEqualTo("m1");
    assertThat(accuracy.labelKey()).isEqualTo("class");
    assertThat(accuracy.value()).isCloseTo(0.5, within(1e-9));
    assertThat(codec.readConfusionMatrices(done.getConfusionMatrices())).isNotEmpty();
  }

  @Test
  void workerComputesRankingMetrics() {
    long img1 = jdbcTemplate.queryForObject("SELECT id FROM datums WHERE uid = 'img1'", Long.class);
    long model = jdbcTemplate.queryForObject("SELECT id FROM models WHERE name = 'm1'", Long.class);
    insertGroundTruth(insertAnnotation(img1, null, "ranking", "{}"), label("animal", "dog"));
    long ranking = insertAnnotation(img1, model, "ranking", "{}");
    insertPrediction(ranking, label("animal", "cat"), 0.9);
    insertPrediction(ranking, label("animal", "dog"), 0.3);

    CreateResult created =
        lifecycleService.createOrGet(
            new EvaluationRequest(List.of("m1"), null, EvaluationParameters.of(TaskType.RANKING)));
    worker.run(created.evaluation().getId());

    Evaluation done = lifecycleService.get(created.evaluation().getId());
    assertThat(done.getStatus()).isEqualTo(EvaluationStatus.DONE);
    List<Metric> metrics = codec.readMetrics(done.getMetrics());
    assertThat(metrics)
        .filteredOn(m -> m.type().equals("MRR"))
        .singleElement()
        .satisfies(
            m -> {
              assertThat(m.labelKey()).isEqualTo("animal");
              assertThat(m.value()).isCloseTo(0.5, within(1e-9));
            });
    assertThat(metrics).noneMatch(m -> "class".equals(m.labelKey()));
  }

  @Test
  void identicalRequestAfterCompletionReturnsFinishedJob() {
    CreateResult created = lifecycleService.createOrGet(request);
    worker.run(created.evaluation().getId());

    CreateResult again =
        lifecycleService.createOrGet(
            new EvaluationRequest(
                List.of("m1"), null, EvaluationParameters.of(TaskType.CLASSIFICATION)));

    assertThat(again.created()).isFalse();
    assertThat(again.evaluation().getStatus()).isEqualTo(EvaluationStatus.DONE);
  }

  @Test
  void listByModelFindsJobsContainingTheModel() {
    CreateResult created = lifecycleService.createOrGet(request);

    assertThat(lifecycleService.listByModel("m1"))
        .extracting(Evaluation::getId)
        .containsExactly(created.evaluation().getId());
    assertThat(lifecycleService.listByModel("m2")).isEmpty();
  }
}

package dev.valor.api;

import dev.valor.evaluation.CreateResult;
import dev.valor.evaluation.EvaluationCodec;
import dev.valor.evaluation.EvaluationLifecycleService;
import dev.valor.evaluation.EvaluationStatus;
import dev.valor.evaluation.EvaluationWorker;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST adapter over {@link EvaluationLifecycleService}. */
@RestController
@RequestMapping("/evaluations")
public class EvaluationController {

  private final EvaluationLifecycleService lifecycleService;
  private final EvaluationWorker worker;
  private final EvaluationCodec codec;

  public EvaluationController(
      EvaluationLifecycleService lifecycleService,
      EvaluationWorker worker,
      EvaluationCodec codec) {
    this.lifecycleService = lifecycleService;
    this.worker = worker;
    this.codec = codec;
  }

  /**
   * Creates an evaluation job, or returns the existing job for an identical request. A job that is
   * still pending is handed to the worker pool; the call returns without waiting for it.
   *
   * @return 201 with the new job, or 200 with the existing one
   */
  @PostMapping
  public ResponseEntity<EvaluationResponse> create(@RequestBody EvaluationRequestBody body) {
    CreateResult result = lifecycleService.createOrGet(body.toRequest());
    if (result.evaluation().getStatus() == EvaluationStatus.PENDING) {
      worker.dispatch(result.evaluation().getId());
    }
    return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
        .body(EvaluationResponse.from(result.evaluation(), codec));
  }

  @GetMapping("/{id}")
  public EvaluationResponse get(@PathVariable UUID id) {
    return EvaluationResponse.from(lifecycleService.get(id), codec);
  }

  @GetMapping
  public List<EvaluationResponse> listByModel(@RequestParam("model") String modelName) {
    return lifecycleService.listByModel(modelName).stream()
        .map(evaluation -> EvaluationResponse.from(evaluation, codec))
        .toList();
  }
}

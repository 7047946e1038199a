package dev.valor.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.valor.catalog.ModelNotFoundException;
import dev.valor.evaluation.CreateResult;
import dev.valor.evaluation.Evaluation;
import dev.valor.evaluation.EvaluationCodec;
import dev.valor.evaluation.EvaluationLifecycleService;
import dev.valor.evaluation.EvaluationNotFoundException;
import dev.valor.evaluation.EvaluationRequest;
import dev.valor.evaluation.EvaluationStatus;
import dev.valor.evaluation.EvaluationWorker;
import dev.valor.fixture.EvaluationBuilder;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SuppressWarnings("NullAway.Init")
@WebMvcTest(EvaluationController.class)
@Import(EvaluationCodec.class)
class EvaluationControllerTest {

  private static final String REQUEST =
      """
      {"modelNames": ["model-a"],
       "datumFilter": {"op": "eq",
                       "lhs": {"name": "dataset.name", "dtype": "string"},
                       "rhs": {"type": "string", "value": "ds1"}},
       "parameters": {"taskType": "classification"},
       "meta": {"run": 1}}
      """;

  @Autowired MockMvc mockMvc;

  @MockitoBean EvaluationLifecycleService lifecycleService;
  @MockitoBean EvaluationWorker worker;

  @Test
  void newJobIsCreatedAndDispatched() throws Exception {
    Evaluation pending = new EvaluationBuilder().build();
    given(lifecycleService.createOrGet(any(EvaluationRequest.class)))
        .willReturn(new CreateResult(pending, true));

    mockMvc
        .perform(post("/evaluations").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(pending.getId().toString()))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.modelNames[0]").value("model-a"))
        .andExpect(jsonPath("$.datumFilter").doesNotExist());

    verify(worker).dispatch(pending.getId());
  }

  @Test
  void finishedJobIsReturnedWithoutDispatch() throws Exception {
    Evaluation done =
        new EvaluationBuilder()
            .status(EvaluationStatus.DONE)
            .metrics(
                "[{\"type\":\"Accuracy\",\"modelName\":\"model-a\",\"parameters\":{},"
                    + "\"labelKey\":\"class\",\"value\":0.5}]")
            .confusionMatrices("[]")
            .durationSeconds(1.5)
            .build();
    given(lifecycleService.createOrGet(any(EvaluationRequest.class)))
        .willReturn(new CreateResult(done, false));

    mockMvc
        .perform(post("/evaluations").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DONE"))
        .andExpect(jsonPath("$.metrics[0].type").value("Accuracy"))
        .andExpect(jsonPath("$.metrics[0].value").value(0.5))
        .andExpect(jsonPath("$.durationSeconds").value(1.5));

    verify(worker, never()).dispatch(any());
  }

  @Test
  void unknownSymbolInFilterIsRejectedWithItsErrorType() throws Exception {
    String body =
        """
        {"modelNames": ["model-a"],
         "datumFilter": {"op": "eq",
                         "lhs": {"name": "dataset.nmae", "dtype": "string"},
                         "rhs": {"type": "string", "value": "ds1"}},
         "parameters": {"taskType": "classification"}}
        """;

    mockMvc
        .perform(post("/evaluations").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorType").value("SymbolError"));

    verify(lifecycleService, never()).createOrGet(any());
  }

  @Test
  void emptyModelListIsAValidationError() throws Exception {
    String body =
        """
        {"modelNames": [], "parameters": {"taskType": "classification"}}
        """;

    mockMvc
        .perform(post("/evaluations").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorType").value("ValidationError"))
        .andExpect(jsonPath("$.detail").value("modelNames must not be empty"));
  }

  @Test
  void unknownModelIsNotFound() throws Exception {
    given(lifecycleService.createOrGet(any(EvaluationRequest.class)))
        .willThrow(new ModelNotFoundException(List.of("model-a")));

    mockMvc
        .perform(post("/evaluations").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("Unknown model(s): model-a"));
  }

  @Test
  void getReturnsStoredJob() throws Exception {
    UUID id = UUID.randomUUID();
    given(lifecycleService.get(id))
        .willReturn(
            new EvaluationBuilder()
                .id(id)
                .status(EvaluationStatus.FAILED)
                .errorMessage("IllegalStateException: boom")
                .build());

    mockMvc
        .perform(get("/evaluations/{id}", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.errorMessage").value("IllegalStateException: boom"));
  }

  @Test
  void getOfUnknownJobIsNotFound() throws Exception {
    UUID id = UUID.randomUUID();
    given(lifecycleService.get(id)).willThrow(new EvaluationNotFoundException(id));

    mockMvc.perform(get("/evaluations/{id}", id)).andExpect(status().isNotFound());
  }

  @Test
  void listByModelReturnsEveryJob() throws Exception {
    given(lifecycleService.listByModel("model-a"))
        .willReturn(List.of(new EvaluationBuilder().build(), new EvaluationBuilder().build()));

    mockMvc
        .perform(get("/evaluations").param("model", "model-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2));
  }
}

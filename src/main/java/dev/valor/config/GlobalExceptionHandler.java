package dev.valor.config;

import dev.valor.catalog.ModelNotFoundException;
import dev.valor.evaluation.EvaluationNotFoundException;
import dev.valor.filter.FilterCompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Filter compilation errors carry their kind in an {@code errorType} property so clients can
 * tell a symbol error from a type mismatch without parsing the message. Database outages are
 * reported as 503 and never as client errors.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String ERROR_TYPE = "errorType";
  static final String VALIDATION_ERROR = "ValidationError";

  /**
   * Maps {@link FilterCompilationException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the compilation error
   * @return a Problem Detail with HTTP 400 status, the message and the error type
   */
  @ExceptionHandler(FilterCompilationException.class)
  ProblemDetail handleFilterCompilation(FilterCompilationException ex) {
    return badRequest(ex.getMessage(), ex.errorType());
  }

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage(), VALIDATION_ERROR);
  }

  /** Unreadable bodies, including values rejected by a record's constructor during binding. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  ProblemDetail handleNotReadable(HttpMessageNotReadableException ex) {
    Throwable cause = ex.getMostSpecificCause();
    if (cause instanceof FilterCompilationException compilation) {
      return handleFilterCompilation(compilation);
    }
    String detail =
        cause instanceof IllegalArgumentException ? cause.getMessage() : "Malformed request body";
    return badRequest(detail, VALIDATION_ERROR);
  }

  @ExceptionHandler({EvaluationNotFoundException.class, ModelNotFoundException.class})
  ProblemDetail handleNotFound(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  /**
   * Maps database unavailability to 503 Service Unavailable.
   *
   * @param ex the infrastructure failure
   * @return a Problem Detail that does not expose driver messages
   */
  @ExceptionHandler({TransientDataAccessException.class, DataAccessResourceFailureException.class})
  ProblemDetail handleDatabaseUnavailable(RuntimeException ex) {
    log.warn("Database unavailable: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Database temporarily unavailable");
  }

  private static ProblemDetail badRequest(String detail, String errorType) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
    problem.setProperty(ERROR_TYPE, errorType);
    return problem;
  }
}

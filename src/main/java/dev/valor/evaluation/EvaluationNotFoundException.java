package dev.valor.evaluation;

import java.util.UUID;

/** Raised when an evaluation id does not exist. */
public class EvaluationNotFoundException extends RuntimeException {

  public EvaluationNotFoundException(UUID id) {
    super("Evaluation " + id + " not found");
  }
}

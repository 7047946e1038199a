package dev.valor.evaluation;

/**
 * Lifecycle states for an {@link Evaluation}.
 *
 * <p>Flow: {@code PENDING → RUNNING → DONE} or {@code PENDING → RUNNING → FAILED}.
 * {@code DONE} and {@code FAILED} are terminal; neither can be reached directly from {@code
 * PENDING}.
 */
public enum EvaluationStatus {
  /** Created, waiting for a worker to claim it. */
  PENDING,
  /** Claimed by exactly one worker. */
  RUNNING,
  /** Metrics computed and attached. */
  DONE,
  /** Computation failed or exceeded the timeout; see the error message. */
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}

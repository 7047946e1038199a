package dev.valor.evaluation;

/**
 * Outcome of a conditional state transition.
 *
 * @param evaluation the job as stored after the attempt
 * @param applied true if this caller performed the transition, false if it was a no-op
 */
public record TransitionResult(Evaluation evaluation, boolean applied) {}

package dev.valor.evaluation;

/**
 * Outcome of {@link EvaluationLifecycleService#createOrGet}.
 *
 * @param evaluation the job for the request's fingerprint
 * @param created true if this call inserted it
 */
public record CreateResult(Evaluation evaluation, boolean created) {}

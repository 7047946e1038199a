package dev.valor.filter;

/**
 * Base type for every semantic error detected while compiling a filter expression.
 *
 * <p>All subclasses are raised before any statement reaches the database. Infrastructure failures
 * (connection loss, timeouts) never use this hierarchy.
 */
public abstract class FilterCompilationException extends RuntimeException {

  protected FilterCompilationException(String message) {
    super(message);
  }

  /**
   * Stable, machine-readable error kind reported to clients.
   *
   * @return the error type identifier, e.g. {@code "SymbolError"}
   */
  public abstract String errorType();
}

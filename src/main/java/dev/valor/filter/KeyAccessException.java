package dev.valor.filter;

/** Raised when a key is applied to an attribute that is not dictionary-valued. */
public class KeyAccessException extends FilterCompilationException {

  public KeyAccessException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "KeyAccessError";
  }
}

package dev.valor.filter;

/** Raised when an operator is outside the category set of the resolved operand type. */
public class UnsupportedOperatorException extends FilterCompilationException {

  public UnsupportedOperatorException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "UnsupportedOperatorError";
  }
}

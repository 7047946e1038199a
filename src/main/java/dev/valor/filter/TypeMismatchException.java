package dev.valor.filter;

/** Raised when a symbol's declared dtype disagrees with its operand or its attribute. */
public class TypeMismatchException extends FilterCompilationException {

  public TypeMismatchException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "TypeMismatchError";
  }
}

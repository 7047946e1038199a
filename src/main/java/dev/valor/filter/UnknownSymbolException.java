package dev.valor.filter;

/** Raised when a symbol names an attribute the registry does not know. */
public class UnknownSymbolException extends FilterCompilationException {

  public UnknownSymbolException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "SymbolError";
  }
}

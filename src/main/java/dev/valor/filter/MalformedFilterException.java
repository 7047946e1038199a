package dev.valor.filter;

/** Raised for malformed trees and literals whose shape fails their type's structural validator. */
public class MalformedFilterException extends FilterCompilationException {

  public MalformedFilterException(String message) {
    super(message);
  }

  @Override
  public String errorType() {
    return "StructuralError";
  }
}

package dev.valor.catalog;

import java.util.Collection;

/** Raised when an evaluation references models that are not registered. */
public class ModelNotFoundException extends RuntimeException {

  public ModelNotFoundException(Collection<String> missing) {
    super("Unknown model(s): " + String.join(", ", missing));
  }
}

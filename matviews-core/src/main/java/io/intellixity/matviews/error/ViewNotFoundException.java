package io.intellixity.matviews.error;

/** The operation expects the materialized view to exist and it does not. */
public final class ViewNotFoundException extends MatViewsException {
  public ViewNotFoundException(String qualifiedName) {
    super("Materialized view " + qualifiedName + " does not exist");
  }
}

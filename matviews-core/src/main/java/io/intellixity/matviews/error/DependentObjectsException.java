package io.intellixity.matviews.error;

/** A {@code DROP ... RESTRICT} was blocked by dependent objects. */
public final class DependentObjectsException extends MatViewsException {
  public static final String CASCADE_HINT = "dependencies exist. Use cascade=true to force drop.";

  public DependentObjectsException(String driverMessage, Throwable cause) {
    super(driverMessage + " - " + CASCADE_HINT, cause);
  }
}

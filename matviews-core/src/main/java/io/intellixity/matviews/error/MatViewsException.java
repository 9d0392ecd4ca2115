package io.intellixity.matviews.error;

/**
 * Root of the lifecycle engine's exception taxonomy.
 * <p>
 * Operations throw subclasses from their prepare/execute phases; the service driver converts every one of
 * them into an error {@link io.intellixity.matviews.response.ServiceResponse}, so callers branch on the
 * serialized error rather than on these types.
 */
public class MatViewsException extends RuntimeException {
  public MatViewsException(String message) {
    super(message);
  }

  public MatViewsException(String message, Throwable cause) {
    super(message, cause);
  }
}

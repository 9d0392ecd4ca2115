package io.intellixity.matviews.error;

/**
 * Lock / object-in-use failure reported by PostgreSQL.
 * <p>
 * Expected under load and safe to retry; the engine itself never retries.
 */
public final class LockContentionException extends MatViewsException {
  public LockContentionException(String message, Throwable cause) {
    super(message, cause);
  }
}

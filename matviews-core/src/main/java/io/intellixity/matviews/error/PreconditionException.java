package io.intellixity.matviews.error;

/** A database-side precondition is missing (e.g. no unique index for a concurrent refresh). */
public final class PreconditionException extends MatViewsException {
  public PreconditionException(String message) {
    super(message);
  }
}

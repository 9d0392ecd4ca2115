package io.intellixity.matviews.spi.sql;

import java.util.function.Supplier;

/**
 * One database connection as seen by an operation.\n
 *
 * Every operation runs its whole statement sequence through a single session, so search path, current
 * role and transaction state are consistent for the duration of the call.\n
 * Failures surface as {@link io.intellixity.matviews.error.SqlExecutionException}.\n
 */
public interface PgSession {
  /** First column of the first row, or null when the query returned no rows. */
  Object queryValue(SqlStatement stmt);

  void execute(SqlStatement stmt);

  /**
   * Run {@code work} atomically: a new transaction when none is open, a savepoint otherwise.
   * Rolled back when {@code work} throws.
   */
  <T> T inTransaction(Supplier<T> work);

  /**
   * True only when the connection is provably outside any transaction or savepoint.
   * Implementations return false when they cannot tell.
   */
  boolean isIdle();

  default long queryLong(SqlStatement stmt) {
    Object v = queryValue(stmt);
    if (v == null) return 0L;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(String.valueOf(v).trim());
  }

  default boolean queryBoolean(SqlStatement stmt) {
    Object v = queryValue(stmt);
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    if (v instanceof Number n) return n.longValue() != 0;
    String s = String.valueOf(v).trim();
    return "t".equalsIgnoreCase(s) || "true".equalsIgnoreCase(s);
  }

  default String queryString(SqlStatement stmt) {
    Object v = queryValue(stmt);
    return v == null ? null : String.valueOf(v);
  }
}

package io.intellixity.matviews.error;

/** Unchecked wrapper for driver failures; keeps the SQLSTATE so operations can classify it. */
public final class SqlExecutionException extends MatViewsException {
  private final String sqlState;
  private final String sql;

  public SqlExecutionException(String message, String sqlState, String sql, Throwable cause) {
    super(message, cause);
    this.sqlState = sqlState;
    this.sql = sql;
  }

  /** Five-character SQLSTATE, or null when the driver did not report one. */
  public String sqlState() { return sqlState; }

  public String sql() { return sql; }

  public boolean hasSqlState(String... states) {
    if (sqlState == null) return false;
    for (String s : states) {
      if (sqlState.equals(s)) return true;
    }
    return false;
  }
}

package io.intellixity.matviews.jdbc;

import io.intellixity.matviews.error.SqlExecutionException;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.SqlStatement;
import org.postgresql.core.BaseConnection;
import org.postgresql.core.TransactionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link PgSession} over one borrowed JDBC {@link Connection}.
 * <p>
 * Does not own the connection. Idle detection asks pgjdbc for the protocol-level transaction state (works
 * through pool proxies via {@link Connection#unwrap}); other drivers fall back to auto-commit.
 */
public final class JdbcPgSession implements PgSession {
  private static final Logger log = LoggerFactory.getLogger(JdbcPgSession.class);

  private final Connection conn;
  private int txDepth;

  public JdbcPgSession(Connection conn) {
    this.conn = Objects.requireNonNull(conn, "conn");
  }

  @Override
  public Object queryValue(SqlStatement stmt) {
    try (PreparedStatement ps = conn.prepareStatement(stmt.sql())) {
      bindAll(ps, stmt);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getObject(1) : null;
      }
    } catch (SQLException e) {
      throw wrap(e, stmt);
    }
  }

  @Override
  public void execute(SqlStatement stmt) {
    try {
      if (stmt.params().isEmpty()) {
        try (Statement st = conn.createStatement()) {
          st.execute(stmt.sql());
        }
      } else {
        try (PreparedStatement ps = conn.prepareStatement(stmt.sql())) {
          bindAll(ps, stmt);
          ps.execute();
        }
      }
    } catch (SQLException e) {
      throw wrap(e, stmt);
    }
  }

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    Objects.requireNonNull(work, "work");
    boolean autoCommit = autoCommit();
    return autoCommit ? runInNewTx(work) : runInSavepoint(work);
  }

  private <T> T runInNewTx(Supplier<T> work) {
    setAutoCommit(false);
    txDepth++;
    T result;
    try {
      result = work.get();
      conn.commit();
    } catch (SQLException e) {
      rollback(null, e);
      SqlExecutionException wrapped = wrap(e, null);
      restoreAutoCommit(wrapped);
      throw wrapped;
    } catch (RuntimeException | Error e) {
      rollback(null, e);
      restoreAutoCommit(e);
      throw e;
    } finally {
      txDepth--;
    }
    restoreAutoCommit(null);
    return result;
  }

  // Never replaces the transaction's own outcome: a failure rides along as suppressed, or is logged after a commit.
  private void restoreAutoCommit(Throwable primary) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      if (primary != null) {
        primary.addSuppressed(e);
      } else {
        log.warn("matviews.jdbc autoCommit restore failed after commit sqlState={}", e.getSQLState(), e);
      }
    }
  }

  private <T> T runInSavepoint(Supplier<T> work) {
    Savepoint sp;
    try {
      sp = conn.setSavepoint();
    } catch (SQLException e) {
      throw wrap(e, null);
    }
    txDepth++;
    try {
      T result = work.get();
      conn.releaseSavepoint(sp);
      return result;
    } catch (SQLException e) {
      rollback(sp, e);
      throw wrap(e, null);
    } catch (RuntimeException | Error e) {
      rollback(sp, e);
      throw e;
    } finally {
      txDepth--;
    }
  }

  @Override
  public boolean isIdle() {
    if (txDepth > 0) return false;
    try {
      if (conn.isWrapperFor(BaseConnection.class)) {
        return conn.unwrap(BaseConnection.class).getTransactionState() == TransactionState.IDLE;
      }
      return conn.getAutoCommit();
    } catch (SQLException | RuntimeException e) {
      log.debug("matviews.jdbc transaction state unavailable, treating session as busy", e);
      return false;
    }
  }

  private void rollback(Savepoint sp, Throwable cause) {
    try {
      if (sp == null) conn.rollback();
      else conn.rollback(sp);
    } catch (SQLException e) {
      log.warn("matviews.jdbc rollback failed", e);
      cause.addSuppressed(e);
    }
  }

  private boolean autoCommit() {
    try {
      return conn.getAutoCommit();
    } catch (SQLException e) {
      throw wrap(e, null);
    }
  }

  private void setAutoCommit(boolean value) {
    try {
      conn.setAutoCommit(value);
    } catch (SQLException e) {
      throw wrap(e, null);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    int i = 1;
    for (Object p : stmt.params()) ps.setObject(i++, p);
  }

  static SqlExecutionException wrap(SQLException e, SqlStatement stmt) {
    String sql = (stmt == null) ? null : stmt.sql();
    return new SqlExecutionException(e.getMessage(), e.getSQLState(), sql, e);
  }
}

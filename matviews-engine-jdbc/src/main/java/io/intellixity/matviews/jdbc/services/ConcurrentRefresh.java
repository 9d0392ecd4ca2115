package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.error.LockContentionException;
import io.intellixity.matviews.error.PreconditionException;
import io.intellixity.matviews.error.SqlExecutionException;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.AbstractMatViewService;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.PgSqlStates;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@code REFRESH MATERIALIZED VIEW CONCURRENTLY}: the view stays readable throughout.
 * <p>
 * Requires a unique index on the view. PostgreSQL refuses {@code CONCURRENTLY} inside a transaction, so a
 * session that is not idle gets the plain refresh instead. Lock contention is reported as
 * {@link LockContentionException} so callers can retry.
 */
public final class ConcurrentRefresh extends AbstractMatViewService {
  private static final Logger log = LoggerFactory.getLogger(ConcurrentRefresh.class);

  public ConcurrentRefresh(MatViewDefinition definition, PgSession session, RefreshOptions options) {
    super(definition, session, (options == null ? RefreshOptions.DEFAULT : options).rowCountStrategy());
  }

  @Override public String operation() { return "refresh.concurrent"; }

  @Override
  public void assignRequest() {
    request().put("row_count_strategy", rowCountStrategy().id());
    request().put("concurrent", true);
  }

  @Override
  public void prepare() {
    requireValidName();
    requireViewExists();
    if (!uniqueIndexExists()) {
      throw new PreconditionException(
          "Materialized view " + qualified() + " must have a unique index for concurrent refresh");
    }
  }

  @Override
  public ServiceResponse execute() {
    response().put("view", qualified().toString());
    response().put("row_count_before", fetchRowCount());

    boolean concurrently = sessionIdle();
    if (!concurrently) {
      log.warn("matviews session inside a transaction, falling back to blocking refresh view={}", qualified());
    }
    response().put("concurrently", concurrently);

    SqlStatement stmt = MatViewSql.refresh(qualified(), concurrently);
    response().put("sql", List.of(stmt.sql()));
    try {
      run(stmt);
    } catch (SqlExecutionException e) {
      if (e.hasSqlState(PgSqlStates.OBJECT_IN_USE, PgSqlStates.LOCK_NOT_AVAILABLE)) {
        throw new LockContentionException(
            "Concurrent refresh of " + qualified() + " blocked by a conflicting lock: " + e.getMessage(), e);
      }
      throw e;
    }

    response().put("row_count_after", fetchRowCount());
    return ok(ServiceStatus.UPDATED);
  }
}

package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.error.DependentObjectsException;
import io.intellixity.matviews.error.SqlExecutionException;
import io.intellixity.matviews.exec.DeleteOptions;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.AbstractMatViewService;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.PgSqlStates;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.SqlStatement;

import java.util.List;

/**
 * Drops the view, {@code RESTRICT} unless {@code cascade} is set.
 * <p>
 * Idempotent by default: an absent view yields {@code skipped}. With {@code ifExists=false} an absent view is
 * an error instead. A drop blocked by dependents is re-reported with a hint to use cascade.
 */
public final class DeleteView extends AbstractMatViewService {
  private final boolean cascade;
  private final boolean ifExists;

  public DeleteView(MatViewDefinition definition, PgSession session, DeleteOptions options) {
    super(definition, session, (options == null ? DeleteOptions.DEFAULT : options).rowCountStrategy());
    DeleteOptions o = (options == null) ? DeleteOptions.DEFAULT : options;
    this.cascade = o.cascade();
    this.ifExists = o.ifExists();
  }

  @Override public String operation() { return "drop"; }

  @Override
  public void assignRequest() {
    request().put("row_count_strategy", rowCountStrategy().id());
    request().put("cascade", cascade);
    request().put("if_exists", ifExists);
  }

  @Override
  public void prepare() {
    requireValidName();
    if (!ifExists) requireViewExists();
  }

  @Override
  public ServiceResponse execute() {
    SqlStatement stmt = MatViewSql.dropIfExists(qualified(), cascade);
    response().put("view", qualified().toString());
    response().put("sql", List.of(stmt.sql()));

    if (!viewExists()) {
      response().put("row_count_before", RowCountStrategy.UNKNOWN);
      response().put("row_count_after", RowCountStrategy.UNKNOWN);
      return ok(ServiceStatus.SKIPPED);
    }

    response().put("row_count_before", fetchRowCount());
    try {
      run(stmt);
    } catch (SqlExecutionException e) {
      if (e.hasSqlState(PgSqlStates.DEPENDENT_OBJECTS_STILL_EXIST)) {
        throw new DependentObjectsException(e.getMessage(), e);
      }
      throw e;
    }
    response().put("row_count_after", RowCountStrategy.UNKNOWN);
    return ok(ServiceStatus.DELETED);
  }
}

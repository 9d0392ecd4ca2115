package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.AbstractMatViewService;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.SqlStatement;

import java.util.List;

/** {@code REFRESH MATERIALIZED VIEW}: blocks readers while it runs. */
public final class RegularRefresh extends AbstractMatViewService {
  public RegularRefresh(MatViewDefinition definition, PgSession session, RefreshOptions options) {
    super(definition, session, (options == null ? RefreshOptions.DEFAULT : options).rowCountStrategy());
  }

  @Override public String operation() { return "refresh.regular"; }

  @Override
  public void assignRequest() {
    request().put("row_count_strategy", rowCountStrategy().id());
  }

  @Override
  public void prepare() {
    requireValidName();
    requireViewExists();
  }

  @Override
  public ServiceResponse execute() {
    response().put("view", qualified().toString());
    response().put("row_count_before", fetchRowCount());
    SqlStatement stmt = MatViewSql.refresh(qualified(), false);
    response().put("sql", List.of(stmt.sql()));
    run(stmt);
    response().put("row_count_after", fetchRowCount());
    return ok(ServiceStatus.UPDATED);
  }
}

package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.AbstractMatViewService;
import io.intellixity.matviews.spi.sql.PgSession;

/** Reports {@code {view, exists}} for the definition's view; status is always {@code ok} on success. */
public final class CheckMatViewExists extends AbstractMatViewService {
  public CheckMatViewExists(MatViewDefinition definition, PgSession session) {
    super(definition, session, RowCountStrategy.NONE);
  }

  @Override public String operation() { return "exists"; }

  @Override public void assignRequest() {}

  @Override
  public void prepare() {
    requireValidName();
  }

  @Override
  public ServiceResponse execute() {
    response().put("view", qualified().toString());
    response().put("exists", viewExists());
    return ok(ServiceStatus.OK);
  }
}

package io.intellixity.matviews.jdbc;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.CreateOptions;
import io.intellixity.matviews.exec.DeleteOptions;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.jdbc.services.CheckMatViewExists;
import io.intellixity.matviews.jdbc.services.CreateView;
import io.intellixity.matviews.jdbc.services.DeleteView;
import io.intellixity.matviews.jdbc.services.MatViewServices;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.spi.exec.MatViewService;
import io.intellixity.matviews.spi.exec.ServiceRunner;
import io.intellixity.matviews.spi.sql.PgSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link MatViewEngine} backed by a JDBC {@link DataSource}.
 * <p>
 * Each call borrows one connection for its whole statement sequence and returns it afterwards. Every statement
 * outside an explicit transaction commits on its own: a pool handing out {@code autoCommit=false} connections
 * is switched to autoCommit for the call and switched back before release. Failing to obtain a connection is
 * reported like any other failure, as an error response.
 */
public final class JdbcMatViewEngine implements MatViewEngine {
  private static final Logger log = LoggerFactory.getLogger(JdbcMatViewEngine.class);

  private final DataSource ds;

  public JdbcMatViewEngine(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public ServiceResponse create(MatViewDefinition definition, CreateOptions options) {
    Objects.requireNonNull(definition, "definition");
    return withSession(s -> new CreateView(definition, s, options));
  }

  @Override
  public ServiceResponse refresh(MatViewDefinition definition, RefreshOptions options) {
    Objects.requireNonNull(definition, "definition");
    return withSession(s -> MatViewServices.refresh(definition, s, options));
  }

  @Override
  public ServiceResponse delete(MatViewDefinition definition, DeleteOptions options) {
    Objects.requireNonNull(definition, "definition");
    return withSession(s -> new DeleteView(definition, s, options));
  }

  @Override
  public ServiceResponse exists(MatViewDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    return withSession(s -> new CheckMatViewExists(definition, s));
  }

  private ServiceResponse withSession(Function<PgSession, MatViewService> factory) {
    Connection c;
    try {
      c = ds.getConnection();
    } catch (SQLException e) {
      log.warn("matviews.jdbc could not obtain a connection: {}", e.getMessage());
      return ServiceResponse.error(JdbcPgSession.wrap(e, null), Map.of(), Map.of());
    }
    try {
      boolean wasAutoCommit;
      try {
        wasAutoCommit = c.getAutoCommit();
        if (!wasAutoCommit) c.setAutoCommit(true);
      } catch (SQLException e) {
        log.warn("matviews.jdbc could not switch connection to autoCommit: {}", e.getMessage());
        return ServiceResponse.error(JdbcPgSession.wrap(e, null), Map.of(), Map.of());
      }
      try {
        return ServiceRunner.run(factory.apply(new JdbcPgSession(c)));
      } finally {
        if (!wasAutoCommit) restoreManualCommit(c);
      }
    } finally {
      try {
        c.close();
      } catch (SQLException e) {
        log.warn("matviews.jdbc failed to release connection", e);
      }
    }
  }

  private static void restoreManualCommit(Connection c) {
    try {
      c.setAutoCommit(false);
    } catch (SQLException e) {
      log.warn("matviews.jdbc failed to restore autoCommit=false", e);
    }
  }
}

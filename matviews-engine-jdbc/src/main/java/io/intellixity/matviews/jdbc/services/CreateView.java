package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.definition.RefreshStrategy;
import io.intellixity.matviews.error.DefinitionValidationException;
import io.intellixity.matviews.exec.CreateOptions;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.AbstractMatViewService;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.QualifiedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Creates the materialized view {@code WITH DATA}.
 * <p>
 * An existing view is left alone ({@code skipped}) unless {@code force} is set, in which case it is dropped
 * first. Concurrent-strategy definitions also get their unique index, built {@code CONCURRENTLY} only when
 * the session is outside a transaction.
 */
public final class CreateView extends AbstractMatViewService {
  private static final Logger log = LoggerFactory.getLogger(CreateView.class);

  private final boolean force;

  public CreateView(MatViewDefinition definition, PgSession session, CreateOptions options) {
    super(definition, session, RowCountStrategy.NONE);
    this.force = options != null && options.force();
  }

  @Override public String operation() { return "create"; }

  @Override
  public void assignRequest() {
    request().put("force", force);
  }

  @Override
  public void prepare() {
    List<String> violations = definition().validate();
    if (!violations.isEmpty()) throw new DefinitionValidationException(violations);
  }

  @Override
  public ServiceResponse execute() {
    QualifiedName q = qualified();
    response().put("view", q.toString());

    if (viewExists()) {
      if (!force) {
        log.info("matviews create skipped, view exists view={}", q);
        response().put("created_indexes", List.of());
        response().put("sql", List.of());
        return ok(ServiceStatus.SKIPPED);
      }
      run(MatViewSql.dropIfExists(q));
    }

    run(MatViewSql.createMatView(q, definition().sql()));
    List<String> indexes = ensureUniqueIndex(q);

    response().put("created_indexes", indexes);
    response().put("sql", executedSql());
    return ok(ServiceStatus.CREATED);
  }

  private List<String> ensureUniqueIndex(QualifiedName q) {
    if (strategy() != RefreshStrategy.CONCURRENT) return List.of();
    String name = MatViewSql.uniqueIndexName(q, columns());
    boolean concurrently = sessionIdle();
    run(MatViewSql.createUniqueIndex(name, q, columns(), concurrently));
    return List.of(name);
  }
}

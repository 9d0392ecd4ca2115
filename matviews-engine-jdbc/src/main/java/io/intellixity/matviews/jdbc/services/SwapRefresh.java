package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.error.DefinitionValidationException;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.AbstractMatViewService;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.QualifiedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Zero-downtime rebuild.\n
 *
 * 1. build {@code <rel>__tmp_<hex>} from the definition's SQL, {@code WITH DATA}\n
 * 2. in one transaction: rename current to {@code <rel>__old_<hex>}, rename temp to {@code <rel>},
 *    drop old, recreate the declared unique index\n
 *
 * Readers never block on a refresh lock and no unique index is required; the cost is double storage while
 * the replacement is built. A failed swap leaves the current view untouched and drops the temp view.
 */
public final class SwapRefresh extends AbstractMatViewService {
  private static final Logger log = LoggerFactory.getLogger(SwapRefresh.class);
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final int MAX_IDENT = 63;
  private static final int TOKEN_BYTES = 6;

  public SwapRefresh(MatViewDefinition definition, PgSession session, RefreshOptions options) {
    super(definition, session, (options == null ? RefreshOptions.DEFAULT : options).rowCountStrategy());
  }

  @Override public String operation() { return "refresh.swap"; }

  @Override
  public void assignRequest() {
    request().put("row_count_strategy", rowCountStrategy().id());
    request().put("swap", true);
  }

  @Override
  public void prepare() {
    requireValidName();
    if (!definition().hasSelectSql()) throw new DefinitionValidationException("SQL must start with SELECT");
    requireViewExists();
  }

  @Override
  public ServiceResponse execute() {
    QualifiedName current = qualified();
    QualifiedName temp = current.sibling(scratchName(rel(), "tmp"));
    String oldName = scratchName(rel(), "old");

    response().put("view", current.toString());
    response().put("row_count_before", fetchRowCount());

    run(MatViewSql.createMatView(temp, definition().sql()));
    try {
      session().inTransaction(() -> {
        run(MatViewSql.rename(current, oldName));
        run(MatViewSql.rename(temp, rel()));
        run(MatViewSql.drop(current.sibling(oldName)));
        if (!columns().isEmpty()) {
          run(MatViewSql.createUniqueIndex(MatViewSql.uniqueIndexName(current, columns()), current, columns(), false));
        }
        return null;
      });
    } catch (RuntimeException e) {
      response().put("sql", executedSql());
      dropTemp(temp, e);
      throw e;
    }

    response().put("sql", executedSql());
    response().put("row_count_after", fetchRowCount());
    return ok(ServiceStatus.UPDATED);
  }

  private void dropTemp(QualifiedName temp, RuntimeException cause) {
    try {
      session().execute(MatViewSql.dropIfExists(temp));
    } catch (RuntimeException cleanup) {
      log.warn("matviews swap cleanup failed, temp view left behind view={}", temp, cleanup);
      cause.addSuppressed(cleanup);
    }
  }

  /** {@code <rel>__<kind>_<12 hex>}, with {@code rel} shortened so the result fits in one identifier. */
  static String scratchName(String rel, String kind) {
    byte[] token = new byte[TOKEN_BYTES];
    RANDOM.nextBytes(token);
    String suffix = "__" + kind + "_" + HexFormat.of().formatHex(token);
    int room = MAX_IDENT - suffix.length();
    String prefix = rel.length() > room ? rel.substring(0, room) : rel;
    return prefix + suffix;
  }
}

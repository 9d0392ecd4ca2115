package io.intellixity.matviews.spi.exec;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.definition.RefreshStrategy;
import io.intellixity.matviews.error.DefinitionValidationException;
import io.intellixity.matviews.error.ViewNotFoundException;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.PgSession;
import io.intellixity.matviews.spi.sql.QualifiedName;
import io.intellixity.matviews.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared state and helpers for lifecycle operations.\n
 *
 * Responsibilities:\n
 * - schema resolution from the session's search path\n
 * - existence / unique-index checks against the catalog\n
 * - row counting per {@link RowCountStrategy}\n
 * - idle-transaction detection before any {@code CONCURRENTLY} statement\n
 * - request/response accumulation and success responses\n
 *
 * Instances are single-use: one operation invocation each.
 */
public abstract class AbstractMatViewService implements MatViewService {
  private static final Logger log = LoggerFactory.getLogger(AbstractMatViewService.class);

  public static final String DEFAULT_SCHEMA = "public";

  private final MatViewDefinition definition;
  private final PgSession session;
  private final RowCountStrategy rowCountStrategy;
  private final Map<String, Object> request = new LinkedHashMap<>();
  private final Map<String, Object> response = new LinkedHashMap<>();
  private final List<String> executed = new ArrayList<>();

  private String schema;
  private String currentUser;

  protected AbstractMatViewService(MatViewDefinition definition, PgSession session, RowCountStrategy rowCountStrategy) {
    this.definition = Objects.requireNonNull(definition, "definition");
    this.session = Objects.requireNonNull(session, "session");
    this.rowCountStrategy = (rowCountStrategy == null) ? RowCountStrategy.NONE : rowCountStrategy;
  }

  protected final MatViewDefinition definition() { return definition; }
  protected final PgSession session() { return session; }
  protected final RowCountStrategy rowCountStrategy() { return rowCountStrategy; }

  @Override public final Map<String, Object> request() { return request; }
  @Override public final Map<String, Object> response() { return response; }

  /** Statements executed so far (DDL only, catalog queries excluded), in order. */
  protected final List<String> executedSql() { return List.copyOf(executed); }

  protected final String rel() { return definition.name(); }

  protected final RefreshStrategy strategy() { return definition.refreshStrategy(); }

  protected final List<String> columns() { return definition.uniqueIndexColumns(); }

  protected final QualifiedName qualified() { return new QualifiedName(schema(), rel()); }

  protected final ServiceResponse ok(ServiceStatus status) {
    return ServiceResponse.of(status, request, response);
  }

  // ---------------------------------------------------------------------------
  // validation
  // ---------------------------------------------------------------------------

  protected final void requireValidName() {
    if (!definition.hasValidName()) {
      throw new DefinitionValidationException("Invalid view name format: " + quotedName());
    }
  }

  protected final void requireViewExists() {
    if (!viewExists()) throw new ViewNotFoundException(qualified().toString());
  }

  private String quotedName() {
    return definition.name() == null ? "null" : "\"" + definition.name() + "\"";
  }

  // ---------------------------------------------------------------------------
  // schema resolution
  // ---------------------------------------------------------------------------

  /** Resolved once per operation; first existing search-path entry, else {@code public}. */
  protected final String schema() {
    if (schema == null) schema = firstExistingSchema();
    return schema;
  }

  private String firstExistingSchema() {
    String raw = session.queryString(MatViewSql.showSearchPath());
    if (raw == null || raw.isBlank()) raw = DEFAULT_SCHEMA;

    List<String> candidates = new ArrayList<>();
    for (String token : raw.split(",")) {
      String resolved = resolveSchemaToken(token.trim());
      if (resolved != null && !resolved.isEmpty() && !candidates.contains(resolved)) candidates.add(resolved);
    }
    if (!candidates.contains(DEFAULT_SCHEMA)) candidates.add(DEFAULT_SCHEMA);

    for (String c : candidates) {
      if (session.queryBoolean(MatViewSql.schemaExists(c))) {
        log.debug("matviews schema resolved searchPath={} schema={}", raw, c);
        return c;
      }
    }
    return DEFAULT_SCHEMA;
  }

  private String resolveSchemaToken(String token) {
    String cleaned = token;
    if (cleaned.startsWith("\"")) cleaned = cleaned.substring(1);
    if (cleaned.endsWith("\"")) cleaned = cleaned.substring(0, cleaned.length() - 1);
    return "$user".equals(cleaned) ? currentUser() : cleaned;
  }

  private String currentUser() {
    if (currentUser == null) currentUser = session.queryString(MatViewSql.currentUser());
    return currentUser;
  }

  // ---------------------------------------------------------------------------
  // catalog checks
  // ---------------------------------------------------------------------------

  protected final boolean viewExists() {
    return session.queryLong(MatViewSql.matViewExists(qualified())) > 0;
  }

  protected final boolean uniqueIndexExists() {
    return session.queryLong(MatViewSql.uniqueIndexCount(qualified())) > 0;
  }

  /** False whenever the session cannot prove it is outside a transaction. */
  protected final boolean sessionIdle() {
    try {
      return session.isIdle();
    } catch (RuntimeException e) {
      log.debug("matviews idle check failed, assuming open transaction", e);
      return false;
    }
  }

  // ---------------------------------------------------------------------------
  // row counts
  // ---------------------------------------------------------------------------

  protected final long fetchRowCount() {
    return switch (rowCountStrategy) {
      case ESTIMATED -> session.queryLong(MatViewSql.estimatedRowCount(qualified()));
      case EXACT -> session.queryLong(MatViewSql.exactRowCount(qualified()));
      case NONE -> RowCountStrategy.UNKNOWN;
    };
  }

  // ---------------------------------------------------------------------------
  // execution
  // ---------------------------------------------------------------------------

  /** Execute a DDL statement and remember it for the response's {@code sql} list. */
  protected final void run(SqlStatement stmt) {
    long start = System.nanoTime();
    if (log.isDebugEnabled()) log.debug("matviews.sql op={} view={} sql={}", operation(), rel(), stmt.sql());
    session.execute(stmt);
    executed.add(stmt.sql());
    if (log.isDebugEnabled()) {
      log.debug("matviews.sql_done op={} durationMs={}", operation(), (System.nanoTime() - start) / 1_000_000.0);
    }
  }
}

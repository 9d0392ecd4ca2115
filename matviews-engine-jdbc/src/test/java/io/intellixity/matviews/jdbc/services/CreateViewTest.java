package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.definition.RefreshStrategy;
import io.intellixity.matviews.error.DefinitionValidationException;
import io.intellixity.matviews.exec.CreateOptions;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.ServiceRunner;
import io.intellixity.matviews.spi.sql.MatViewSql;
import io.intellixity.matviews.spi.sql.QualifiedName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class CreateViewTest {
  private static final MatViewDefinition CONCURRENT_DEF =
      MatViewDefinition.of("mv_x", "SELECT id FROM t", RefreshStrategy.CONCURRENT, List.of("id"));

  private static ServiceResponse create(FakeCatalogSession s, MatViewDefinition d, boolean force) {
    return ServiceRunner.run(new CreateView(d, s, new CreateOptions(force)));
  }

  @Test
  void createsViewWithUniqueIndexForConcurrentStrategy() {
    FakeCatalogSession s = new FakeCatalogSession();
    ServiceResponse r = create(s, CONCURRENT_DEF, false);

    assertEquals(ServiceStatus.CREATED, r.status());
    assertEquals(Map.of("force", false), r.request());
    assertEquals("public.mv_x", r.response().get("view"));
    assertEquals(List.of("public_mv_x_uniq_id"), r.response().get("created_indexes"));
    assertEquals(List.of(
        "CREATE MATERIALIZED VIEW \"public\".\"mv_x\" AS SELECT id FROM t WITH DATA",
        "CREATE UNIQUE INDEX CONCURRENTLY \"public_mv_x_uniq_id\" ON \"public\".\"mv_x\" (\"id\")"),
        r.response().get("sql"));
    assertTrue(s.hasView("public.mv_x"));
    assertEquals(Set.of("public_mv_x_uniq_id"), s.indexesOf("public.mv_x"));
  }

  @Test
  void longViewNameGetsAnIndexNameThatFitsTheIdentifierLimit() {
    String name = "mv_customer_lifetime_value_by_region_and_quarter_v1";
    FakeCatalogSession s = new FakeCatalogSession();
    ServiceResponse r = create(s, MatViewDefinition.of(name, "SELECT 1 AS customer_id", RefreshStrategy.CONCURRENT,
        List.of("customer_id")), false);

    assertEquals(ServiceStatus.CREATED, r.status());
    String expected = MatViewSql.uniqueIndexName(new QualifiedName("public", name), List.of("customer_id"));
    assertTrue(expected.length() <= MatViewSql.MAX_IDENT_BYTES, expected);
    assertEquals(List.of(expected), r.response().get("created_indexes"));
    assertEquals(Set.of(expected), s.indexesOf("public." + name));
  }

  @Test
  void regularStrategyCreatesNoIndex() {
    FakeCatalogSession s = new FakeCatalogSession();
    ServiceResponse r = create(s, MatViewDefinition.of("mv_x", "SELECT 1", RefreshStrategy.REGULAR, List.of("id")), false);
    assertEquals(ServiceStatus.CREATED, r.status());
    assertEquals(List.of(), r.response().get("created_indexes"));
    assertTrue(s.indexesOf("public.mv_x").isEmpty());
  }

  @Test
  void existingViewIsSkippedWithoutForce() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 5);
    ServiceResponse r = create(s, CONCURRENT_DEF, false);

    assertEquals(ServiceStatus.SKIPPED, r.status());
    assertEquals(List.of(), r.response().get("created_indexes"));
    assertTrue(s.executed.isEmpty());
  }

  @Test
  void forceDropsThenRecreates() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 5).withIndex("public_mv_x_uniq_id", "public.mv_x");
    ServiceResponse r = create(s, CONCURRENT_DEF, true);

    assertEquals(ServiceStatus.CREATED, r.status());
    @SuppressWarnings("unchecked")
    List<String> sql = (List<String>) r.response().get("sql");
    assertEquals("DROP MATERIALIZED VIEW IF EXISTS \"public\".\"mv_x\"", sql.get(0));
    assertEquals(3, sql.size());
    assertEquals(Set.of("public_mv_x_uniq_id"), s.indexesOf("public.mv_x"));
  }

  @Test
  void invalidDefinitionNeverReachesTheDatabase() {
    FakeCatalogSession s = new FakeCatalogSession();
    MatViewDefinition bad = MatViewDefinition.of("mv_x", "SELECT 1", RefreshStrategy.CONCURRENT, List.of());
    ServiceResponse r = create(s, bad, false);

    assertTrue(r.isError());
    assertEquals(DefinitionValidationException.class.getName(), r.error().className());
    assertEquals("refresh_strategy=concurrent requires unique_index_columns (non-empty)", r.error().message());
    assertTrue(s.queries.isEmpty());
    assertTrue(s.executed.isEmpty());
  }

  @Test
  void rejectsNonSelectSqlAndBadNames() {
    FakeCatalogSession s = new FakeCatalogSession();
    ServiceResponse r1 = create(s, MatViewDefinition.of("mv_x", "DROP TABLE t", null, List.of()), false);
    assertEquals("SQL must start with SELECT", r1.error().message());
    ServiceResponse r2 = create(s, MatViewDefinition.of("mv x", "SELECT 1", null, List.of()), false);
    assertEquals("Invalid view name format: \"mv x\"", r2.error().message());
    assertTrue(s.queries.isEmpty());
  }

  @Test
  void busySessionBuildsIndexWithoutConcurrently() {
    FakeCatalogSession s = new FakeCatalogSession();
    s.idle = false;
    ServiceResponse r = create(s, CONCURRENT_DEF, false);

    assertEquals(ServiceStatus.CREATED, r.status());
    assertEquals("CREATE UNIQUE INDEX \"public_mv_x_uniq_id\" ON \"public\".\"mv_x\" (\"id\")", s.executed.get(1));
  }

  @Test
  void usesFirstExistingSearchPathSchema() {
    FakeCatalogSession s = new FakeCatalogSession();
    s.searchPath = "reporting, public";
    s.schemas.add("reporting");
    ServiceResponse r = create(s, CONCURRENT_DEF, false);
    assertEquals("reporting.mv_x", r.response().get("view"));
    assertEquals(List.of("reporting_mv_x_uniq_id"), r.response().get("created_indexes"));
  }
}

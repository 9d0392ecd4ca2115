package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.definition.RefreshStrategy;
import io.intellixity.matviews.error.LockContentionException;
import io.intellixity.matviews.error.PreconditionException;
import io.intellixity.matviews.error.SqlExecutionException;
import io.intellixity.matviews.error.ViewNotFoundException;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.response.ServiceStatus;
import io.intellixity.matviews.spi.exec.ServiceRunner;
import io.intellixity.matviews.spi.sql.PgSqlStates;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RefreshTest {
  private static final MatViewDefinition REGULAR =
      MatViewDefinition.of("mv_x", "SELECT id FROM t", RefreshStrategy.REGULAR, List.of());
  private static final MatViewDefinition CONCURRENT =
      MatViewDefinition.of("mv_x", "SELECT id FROM t", RefreshStrategy.CONCURRENT, List.of("id"));

  private static ServiceResponse refresh(FakeCatalogSession s, MatViewDefinition d, RowCountStrategy counts) {
    return ServiceRunner.run(MatViewServices.refresh(d, s, new RefreshOptions(counts)));
  }

  @Test
  void dispatchesByStrategy() {
    FakeCatalogSession s = new FakeCatalogSession();
    assertInstanceOf(RegularRefresh.class, MatViewServices.refresh(REGULAR, s, RefreshOptions.DEFAULT));
    assertInstanceOf(ConcurrentRefresh.class, MatViewServices.refresh(CONCURRENT, s, RefreshOptions.DEFAULT));
    MatViewDefinition swap = MatViewDefinition.of("mv_x", "SELECT 1", RefreshStrategy.SWAP, List.of());
    assertInstanceOf(SwapRefresh.class, MatViewServices.refresh(swap, s, RefreshOptions.DEFAULT));
  }

  @Test
  void regularRefreshReportsCounts() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 7);
    ServiceResponse r = refresh(s, REGULAR, RowCountStrategy.EXACT);

    assertEquals(ServiceStatus.UPDATED, r.status());
    assertEquals("exact", r.request().get("row_count_strategy"));
    assertEquals(7L, r.response().get("row_count_before"));
    assertEquals(7L, r.response().get("row_count_after"));
    assertEquals(List.of("REFRESH MATERIALIZED VIEW \"public\".\"mv_x\""), r.response().get("sql"));
  }

  @Test
  void noneStrategyIssuesNoCountQueries() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 7);
    ServiceResponse r = refresh(s, REGULAR, RowCountStrategy.NONE);

    assertEquals(RowCountStrategy.UNKNOWN, r.response().get("row_count_before"));
    assertEquals(RowCountStrategy.UNKNOWN, r.response().get("row_count_after"));
    assertEquals(0, s.countQueries());
  }

  @Test
  void missingViewIsAnErrorAndRunsNoDdl() {
    FakeCatalogSession s = new FakeCatalogSession();
    ServiceResponse r = refresh(s, REGULAR, RowCountStrategy.ESTIMATED);

    assertEquals(ViewNotFoundException.class.getName(), r.error().className());
    assertTrue(s.executed.isEmpty());
  }

  @Test
  void concurrentRefreshRunsConcurrently() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 3).withIndex("public_mv_x_uniq_id", "public.mv_x");
    ServiceResponse r = refresh(s, CONCURRENT, RowCountStrategy.ESTIMATED);

    assertEquals(ServiceStatus.UPDATED, r.status());
    assertEquals(true, r.request().get("concurrent"));
    assertEquals(true, r.response().get("concurrently"));
    assertEquals(List.of("REFRESH MATERIALIZED VIEW CONCURRENTLY \"public\".\"mv_x\""), r.response().get("sql"));
    assertEquals(3L, r.response().get("row_count_before"));
  }

  @Test
  void concurrentRefreshNeedsUniqueIndex() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 3);
    ServiceResponse r = refresh(s, CONCURRENT, RowCountStrategy.NONE);

    assertEquals(PreconditionException.class.getName(), r.error().className());
    assertEquals("Materialized view public.mv_x must have a unique index for concurrent refresh", r.error().message());
    assertTrue(s.executed.isEmpty());
  }

  @Test
  void concurrentRefreshFallsBackInsideTransaction() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 3).withIndex("public_mv_x_uniq_id", "public.mv_x");
    s.idle = false;
    ServiceResponse r = refresh(s, CONCURRENT, RowCountStrategy.NONE);

    assertEquals(ServiceStatus.UPDATED, r.status());
    assertEquals(false, r.response().get("concurrently"));
    assertEquals(List.of("REFRESH MATERIALIZED VIEW \"public\".\"mv_x\""), s.executed);
  }

  @Test
  void lockContentionIsReportedDistinctly() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 3).withIndex("public_mv_x_uniq_id", "public.mv_x")
        .failOnce("REFRESH MATERIALIZED VIEW CONCURRENTLY", PgSqlStates.LOCK_NOT_AVAILABLE);
    ServiceResponse r = refresh(s, CONCURRENT, RowCountStrategy.NONE);

    assertEquals(LockContentionException.class.getName(), r.error().className());
    assertEquals(List.of("REFRESH MATERIALIZED VIEW CONCURRENTLY \"public\".\"mv_x\""), r.response().get("sql"));
  }

  @Test
  void otherDriverErrorsPassThrough() {
    FakeCatalogSession s = new FakeCatalogSession().withView("public.mv_x", 3).withIndex("public_mv_x_uniq_id", "public.mv_x")
        .failOnce("REFRESH", "XX000");
    ServiceResponse r = refresh(s, CONCURRENT, RowCountStrategy.NONE);
    assertEquals(SqlExecutionException.class.getName(), r.error().className());
  }
}

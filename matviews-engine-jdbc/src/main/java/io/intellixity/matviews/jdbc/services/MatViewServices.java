package io.intellixity.matviews.jdbc.services;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.spi.exec.MatViewService;
import io.intellixity.matviews.spi.sql.PgSession;

/** Picks the refresh operation matching a definition's strategy. */
public final class MatViewServices {
  private MatViewServices() {}

  public static MatViewService refresh(MatViewDefinition definition, PgSession session, RefreshOptions options) {
    return switch (definition.refreshStrategy()) {
      case REGULAR -> new RegularRefresh(definition, session, options);
      case CONCURRENT -> new ConcurrentRefresh(definition, session, options);
      case SWAP -> new SwapRefresh(definition, session, options);
    };
  }
}

package io.intellixity.matviews.jobs;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.exec.RefreshOptions;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.run.RunOperation;
import io.intellixity.matviews.store.DefinitionStore;
import io.intellixity.matviews.store.RunStore;

import java.time.Clock;

/**
 * Refreshes the view with the strategy declared on its definition.
 * <p>
 * The argument is a row-count strategy name or {@code {row_count_strategy}}; absent means {@code estimated}.
 */
public final class RefreshViewJob extends AbstractMatViewJob {
  public static final String NAME = "matviews.refresh";

  public RefreshViewJob(DefinitionStore definitions, RunStore runs, MatViewEngine engine, Clock clock) {
    super(definitions, runs, engine, clock);
  }

  @Override public String name() { return NAME; }
  @Override protected RunOperation operation() { return RunOperation.REFRESH; }

  @Override
  protected ServiceResponse invoke(MatViewEngine engine, MatViewDefinition definition, Object optionsArg) {
    return engine.refresh(definition, options(optionsArg));
  }

  static RefreshOptions options(Object arg) {
    Object raw = JobArgs.option(arg, "row_count_strategy");
    if (raw == null || raw instanceof Boolean) return RefreshOptions.DEFAULT;
    return new RefreshOptions(RowCountStrategy.from(raw));
  }
}

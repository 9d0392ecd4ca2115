package io.intellixity.matviews.jobs;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.DeleteOptions;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.exec.RowCountStrategy;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.run.RunOperation;
import io.intellixity.matviews.store.DefinitionStore;
import io.intellixity.matviews.store.RunStore;

import java.time.Clock;

/**
 * Drops the view, tolerating its absence.
 * <p>
 * The argument is a cascade flag ({@code true}, {@code "true"/"1"/"yes"}, {@code 1}) or {@code {cascade}};
 * a map may also carry {@code row_count_strategy}.
 */
public final class DeleteViewJob extends AbstractMatViewJob {
  public static final String NAME = "matviews.delete";

  public DeleteViewJob(DefinitionStore definitions, RunStore runs, MatViewEngine engine, Clock clock) {
    super(definitions, runs, engine, clock);
  }

  @Override public String name() { return NAME; }
  @Override protected RunOperation operation() { return RunOperation.DROP; }

  @Override
  protected ServiceResponse invoke(MatViewEngine engine, MatViewDefinition definition, Object optionsArg) {
    return engine.delete(definition, options(optionsArg));
  }

  static DeleteOptions options(Object arg) {
    boolean cascade = JobArgs.trueish(JobArgs.option(arg, "cascade"));
    RowCountStrategy counts = RowCountStrategy.from(JobArgs.mapOption(arg, "row_count_strategy"));
    return new DeleteOptions(cascade, true, counts);
  }
}

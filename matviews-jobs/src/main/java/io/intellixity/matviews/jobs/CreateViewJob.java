package io.intellixity.matviews.jobs;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.CreateOptions;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.run.RunOperation;
import io.intellixity.matviews.store.DefinitionStore;
import io.intellixity.matviews.store.RunStore;

import java.time.Clock;

/** Creates the view; the argument is a trueish {@code force} or {@code {force}}. */
public final class CreateViewJob extends AbstractMatViewJob {
  public static final String NAME = "matviews.create";

  public CreateViewJob(DefinitionStore definitions, RunStore runs, MatViewEngine engine, Clock clock) {
    super(definitions, runs, engine, clock);
  }

  @Override public String name() { return NAME; }
  @Override protected RunOperation operation() { return RunOperation.CREATE; }

  @Override
  protected ServiceResponse invoke(MatViewEngine engine, MatViewDefinition definition, Object optionsArg) {
    return engine.create(definition, options(optionsArg));
  }

  static CreateOptions options(Object arg) {
    return new CreateOptions(JobArgs.trueish(JobArgs.option(arg, "force")));
  }
}

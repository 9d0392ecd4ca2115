package io.intellixity.matviews.jobs;

import io.intellixity.matviews.definition.MatViewDefinition;
import io.intellixity.matviews.exec.MatViewEngine;
import io.intellixity.matviews.response.ErrorDetails;
import io.intellixity.matviews.response.ServiceResponse;
import io.intellixity.matviews.run.MatViewRun;
import io.intellixity.matviews.run.RunOperation;
import io.intellixity.matviews.store.DefinitionStore;
import io.intellixity.matviews.store.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps one engine operation with a persisted {@link MatViewRun}.\n
 *
 * Flow:\n
 * - load the definition (missing definition: exception, no run)\n
 * - persist a RUNNING run\n
 * - invoke the engine and time it\n
 * - persist the terminal run, then surface failures to the caller\n
 *
 * An error response raises {@link MatViewJobException}; an exception thrown by the engine is re-thrown as is.
 * In both cases the run is already stored as FAILED.
 */
public abstract class AbstractMatViewJob {
  private static final Logger log = LoggerFactory.getLogger(AbstractMatViewJob.class);

  private final DefinitionStore definitions;
  private final RunStore runs;
  private final MatViewEngine engine;
  private final Clock clock;

  protected AbstractMatViewJob(DefinitionStore definitions, RunStore runs, MatViewEngine engine, Clock clock) {
    this.definitions = Objects.requireNonNull(definitions, "definitions");
    this.runs = Objects.requireNonNull(runs, "runs");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Name used for enqueueing and registry lookups. */
  public abstract String name();

  protected abstract RunOperation operation();

  /** Normalize the raw job argument and call the engine. */
  protected abstract ServiceResponse invoke(MatViewEngine engine, MatViewDefinition definition, Object optionsArg);

  /** Adapter entry point: {@code [definitionId]} or {@code [definitionId, optionsArg]}. */
  public final Map<String, Object> perform(List<?> args) {
    if (args == null || args.isEmpty()) throw new MatViewJobException(name() + " requires a definition id");
    Object optionsArg = args.size() > 1 ? args.get(1) : null;
    return perform(JobArgs.definitionId(args.get(0)), optionsArg);
  }

  public final Map<String, Object> perform(long definitionId, Object optionsArg) {
    MatViewDefinition definition = definitions.findById(definitionId)
        .orElseThrow(() -> new MatViewJobException("Unknown definition id: " + definitionId));

    MatViewRun run = runs.create(MatViewRun.start(definitionId, operation(), clock.instant()));
    log.debug("matviews.job start job={} view={} run={}", name(), definition.name(), run.id());

    long start = System.nanoTime();
    ServiceResponse response;
    try {
      response = invoke(engine, definition, optionsArg);
    } catch (RuntimeException | Error e) {
      try {
        runs.update(run.fail(Map.of(), ErrorDetails.from(e), clock.instant(), elapsedMs(start)));
      } catch (RuntimeException storeFailure) {
        e.addSuppressed(storeFailure);
      }
      log.warn("matviews.job crashed job={} view={} run={}", name(), definition.name(), run.id(), e);
      throw e;
    }

    long durationMs = elapsedMs(start);
    MatViewRun finished = runs.update(run.finish(response, clock.instant(), durationMs));
    log.info("matviews.job done job={} view={} run={} status={} durationMs={}",
        name(), definition.name(), finished.id(), finished.status().id(), durationMs);

    if (response.isError()) throw new MatViewJobException(name(), definition.name(), response);
    return response.toMap();
  }

  private static long elapsedMs(long startNanos) {
    return Math.round((System.nanoTime() - startNanos) / 1_000_000.0);
  }
}

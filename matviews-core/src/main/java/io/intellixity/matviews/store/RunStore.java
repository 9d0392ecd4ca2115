package io.intellixity.matviews.store;

import io.intellixity.matviews.run.MatViewRun;

import java.util.List;
import java.util.Optional;

/** Persistence for {@link MatViewRun} audit records. */
public interface RunStore {
  /** Persist a new run; returns it with its assigned id. */
  MatViewRun create(MatViewRun run);

  /** Overwrite an existing run (matched by id). */
  MatViewRun update(MatViewRun run);

  Optional<MatViewRun> findById(long id);

  /** Runs of one definition, newest first. */
  List<MatViewRun> findByDefinition(long definitionId);

  int deleteByDefinition(long definitionId);

  default Optional<MatViewRun> lastRun(long definitionId) {
    List<MatViewRun> runs = findByDefinition(definitionId);
    return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
  }
}

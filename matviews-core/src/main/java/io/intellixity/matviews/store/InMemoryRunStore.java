package io.intellixity.matviews.store;

import io.intellixity.matviews.run.MatViewRun;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/** Simple in-memory {@link RunStore}. */
public final class InMemoryRunStore implements RunStore {
  private final Map<Long, MatViewRun> byId = new ConcurrentHashMap<>();
  private final AtomicLong seq = new AtomicLong();

  @Override
  public MatViewRun create(MatViewRun run) {
    Objects.requireNonNull(run, "run");
    if (run.id() != null) throw new IllegalArgumentException("Run already persisted: " + run.id());
    MatViewRun stored = run.withId(seq.incrementAndGet());
    byId.put(stored.id(), stored);
    return stored;
  }

  @Override
  public MatViewRun update(MatViewRun run) {
    Objects.requireNonNull(run, "run");
    if (run.id() == null || byId.replace(run.id(), run) == null) {
      throw new IllegalArgumentException("Unknown run id: " + run.id());
    }
    return run;
  }

  @Override
  public Optional<MatViewRun> findById(long id) {
    return Optional.ofNullable(byId.get(id));
  }

  @Override
  public List<MatViewRun> findByDefinition(long definitionId) {
    return byId.values().stream()
        .filter(r -> r.definitionId() == definitionId)
        .sorted(Comparator.comparing(MatViewRun::id).reversed())
        .collect(Collectors.toList());
  }

  @Override
  public int deleteByDefinition(long definitionId) {
    List<Long> ids = byId.values().stream()
        .filter(r -> r.definitionId() == definitionId)
        .map(MatViewRun::id)
        .collect(Collectors.toList());
    ids.forEach(byId::remove);
    return ids.size();
  }
}

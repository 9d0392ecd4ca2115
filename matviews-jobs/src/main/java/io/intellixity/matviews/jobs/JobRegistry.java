package io.intellixity.matviews.jobs;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Immutable job-name to job lookup used by adapters when a job is dequeued. */
public final class JobRegistry {
  private final Map<String, AbstractMatViewJob> byName;

  public JobRegistry(Collection<? extends AbstractMatViewJob> jobs) {
    Map<String, AbstractMatViewJob> m = new LinkedHashMap<>();
    for (AbstractMatViewJob j : Objects.requireNonNull(jobs, "jobs")) {
      if (m.putIfAbsent(j.name(), j) != null) throw new IllegalArgumentException("Duplicate job name: " + j.name());
    }
    this.byName = Map.copyOf(m);
  }

  public static JobRegistry of(AbstractMatViewJob... jobs) {
    return new JobRegistry(List.of(jobs));
  }

  public AbstractMatViewJob get(String name) {
    AbstractMatViewJob j = byName.get(name);
    if (j == null) throw new IllegalArgumentException("Unknown job: " + name);
    return j;
  }

  public boolean contains(String name) { return byName.containsKey(name); }
}

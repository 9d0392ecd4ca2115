package io.intellixity.matviews.jobs;

import java.util.List;
import java.util.Objects;

/** Runs jobs synchronously on the caller's thread; job failures propagate to the caller. */
public final class InlineJobAdapter implements JobAdapter {
  private final JobRegistry registry;

  public InlineJobAdapter(JobRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  @Override
  public void enqueue(String jobName, String queue, List<Object> args) {
    registry.get(jobName).perform(args);
  }
}

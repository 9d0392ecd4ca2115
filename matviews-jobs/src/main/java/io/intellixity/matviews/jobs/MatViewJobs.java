package io.intellixity.matviews.jobs;

import io.intellixity.matviews.exec.RowCountStrategy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Enqueue lifecycle jobs on the configured adapter and queue. */
public final class MatViewJobs {
  private final JobAdapter adapter;
  private final String queue;

  public MatViewJobs(JobAdapter adapter, MatViewsConfig config) {
    this.adapter = Objects.requireNonNull(adapter, "adapter");
    this.queue = Objects.requireNonNull(config, "config").jobQueue();
  }

  public void enqueueCreate(long definitionId, boolean force) {
    enqueue(CreateViewJob.NAME, definitionId, Map.of("force", force));
  }

  public void enqueueRefresh(long definitionId, RowCountStrategy rowCountStrategy) {
    RowCountStrategy s = (rowCountStrategy == null) ? RowCountStrategy.ESTIMATED : rowCountStrategy;
    enqueue(RefreshViewJob.NAME, definitionId, Map.of("row_count_strategy", s.id()));
  }

  public void enqueueDelete(long definitionId, boolean cascade, RowCountStrategy rowCountStrategy) {
    Map<String, Object> opts = new LinkedHashMap<>();
    opts.put("cascade", cascade);
    if (rowCountStrategy != null) opts.put("row_count_strategy", rowCountStrategy.id());
    enqueue(DeleteViewJob.NAME, definitionId, opts);
  }

  public String queue() { return queue; }

  private void enqueue(String job, long definitionId, Map<String, Object> options) {
    adapter.enqueue(job, queue, List.of(definitionId, options));
  }
}

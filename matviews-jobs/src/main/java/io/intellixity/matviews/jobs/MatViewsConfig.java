package io.intellixity.matviews.jobs;

/**
 * Job-layer configuration, read once at startup.
 *
 * @param jobAdapter    backend used by {@link MatViewJobs}
 * @param jobQueue      queue name for every enqueued job
 * @param workerThreads threads per queue for {@link JobAdapterKind#EXECUTOR}
 */
public record MatViewsConfig(JobAdapterKind jobAdapter, String jobQueue, int workerThreads) {
  public static final String DEFAULT_QUEUE = "default";
  public static final MatViewsConfig DEFAULT = new MatViewsConfig(JobAdapterKind.INLINE, DEFAULT_QUEUE, 1);

  public MatViewsConfig {
    jobAdapter = (jobAdapter == null) ? JobAdapterKind.INLINE : jobAdapter;
    jobQueue = (jobQueue == null || jobQueue.isBlank()) ? DEFAULT_QUEUE : jobQueue.trim();
    if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
  }
}

package io.intellixity.matviews.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the configured {@link JobAdapter}. */
public final class JobAdapters {
  private static final Logger log = LoggerFactory.getLogger(JobAdapters.class);

  private JobAdapters() {}

  public static JobAdapter create(MatViewsConfig config, JobRegistry registry) {
    log.info("matviews.job adapter={} queue={} workerThreads={}",
        config.jobAdapter().id(), config.jobQueue(), config.workerThreads());
    return switch (config.jobAdapter()) {
      case INLINE -> new InlineJobAdapter(registry);
      case EXECUTOR -> new ExecutorJobAdapter(registry, config.workerThreads());
    };
  }
}

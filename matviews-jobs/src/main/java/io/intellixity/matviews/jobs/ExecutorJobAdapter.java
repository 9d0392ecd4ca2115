package io.intellixity.matviews.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process queue: one fixed thread pool per queue name.
 * <p>
 * Job failures are logged (the run record already holds the details); they never kill the worker.
 */
public final class ExecutorJobAdapter implements JobAdapter, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ExecutorJobAdapter.class);

  private final JobRegistry registry;
  private final int threadsPerQueue;
  private final Map<String, ExecutorService> queues = new ConcurrentHashMap<>();
  private volatile boolean closed;

  public ExecutorJobAdapter(JobRegistry registry, int threadsPerQueue) {
    this.registry = Objects.requireNonNull(registry, "registry");
    if (threadsPerQueue < 1) throw new IllegalArgumentException("threadsPerQueue must be >= 1");
    this.threadsPerQueue = threadsPerQueue;
  }

  @Override
  public void enqueue(String jobName, String queue, List<Object> args) {
    if (closed) throw new IllegalStateException("Adapter is closed");
    AbstractMatViewJob job = registry.get(jobName);
    List<Object> snapshot = Collections.unmodifiableList(new ArrayList<>(args));
    queues.computeIfAbsent(queue, this::newQueue).execute(() -> runSafely(job, queue, snapshot));
    log.debug("matviews.job enqueued job={} queue={} args={}", jobName, queue, snapshot);
  }

  private void runSafely(AbstractMatViewJob job, String queue, List<Object> args) {
    try {
      job.perform(args);
    } catch (RuntimeException e) {
      log.error("matviews.job failed job={} queue={} args={}", job.name(), queue, args, e);
    }
  }

  private ExecutorService newQueue(String queue) {
    AtomicInteger seq = new AtomicInteger();
    return Executors.newFixedThreadPool(threadsPerQueue, r -> {
      Thread t = new Thread(r, "matviews-" + queue + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public void close() {
    closed = true;
    queues.values().forEach(ExecutorService::shutdown);
    for (Map.Entry<String, ExecutorService> e : queues.entrySet()) {
      try {
        if (!e.getValue().awaitTermination(30, TimeUnit.SECONDS)) {
          log.warn("matviews.job queue={} did not drain in time, interrupting", e.getKey());
          e.getValue().shutdownNow();
        }
      } catch (InterruptedException ie) {
        e.getValue().shutdownNow();
        Thread.currentThread().interrupt();
        return;
      }
    }
  }
}

package io.intellixity.matviews.jobs;

import java.util.List;

/**
 * Queue backend seam. One implementation is selected at startup from {@link MatViewsConfig}.
 * <p>
 * {@code args} must be plain values (numbers, strings, booleans, maps, lists) so any backend can serialize them.
 */
public interface JobAdapter {
  void enqueue(String jobName, String queue, List<Object> args);
}

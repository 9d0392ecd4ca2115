package io.intellixity.matviews.run;

import io.intellixity.matviews.response.ErrorDetails;
import io.intellixity.matviews.response.ServiceResponse;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one operation invocation.
 * <p>
 * Production code creates runs with {@link #start} and finishes them with {@link #succeed} or {@link #fail};
 * both enforce {@link RunStatus#canTransitionTo}. The canonical constructor accepts any state so fixtures and
 * stores can rebuild arbitrary records, but still refuses an error on a non-failed run.
 */
public record MatViewRun(Long id,
                         long definitionId,
                         RunOperation operation,
                         RunStatus status,
                         Instant startedAt,
                         Instant finishedAt,
                         Long durationMs,
                         Map<String, Object> meta,
                         ErrorDetails error) {
  public MatViewRun {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(status, "status");
    if (error != null && status != RunStatus.FAILED) {
      throw new IllegalArgumentException("error is only allowed on failed runs, got " + status.id());
    }
    meta = (meta == null || meta.isEmpty()) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
  }

  public static MatViewRun start(long definitionId, RunOperation operation, Instant startedAt) {
    return new MatViewRun(null, definitionId, operation, RunStatus.RUNNING, startedAt, null, null, Map.of(), null);
  }

  public MatViewRun withId(long newId) {
    return new MatViewRun(newId, definitionId, operation, status, startedAt, finishedAt, durationMs, meta, error);
  }

  /** Finalize from an engine response: success statuses map to SUCCESS, errors to FAILED. */
  public MatViewRun finish(ServiceResponse response, Instant finishedAt, long durationMs) {
    Objects.requireNonNull(response, "response");
    if (response.isSuccess()) return succeed(response.meta(), finishedAt, durationMs);
    return fail(response.meta(), response.error(), finishedAt, durationMs);
  }

  public MatViewRun succeed(Map<String, Object> meta, Instant finishedAt, long durationMs) {
    return transition(RunStatus.SUCCESS, meta, null, finishedAt, durationMs);
  }

  public MatViewRun fail(Map<String, Object> meta, ErrorDetails error, Instant finishedAt, long durationMs) {
    Objects.requireNonNull(error, "error");
    return transition(RunStatus.FAILED, meta, error, finishedAt, durationMs);
  }

  private MatViewRun transition(RunStatus next, Map<String, Object> newMeta, ErrorDetails err,
                                Instant finished, long duration) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal run transition " + status.id() + " -> " + next.id() + " (run " + id + ")");
    }
    return new MatViewRun(id, definitionId, operation, next, startedAt, finished, duration, newMeta, err);
  }

  public String errorMessage() { return error == null ? null : error.message(); }

  public Long rowCountBefore() { return responseLong("row_count_before"); }

  public Long rowCountAfter() { return responseLong("row_count_after"); }

  private Long responseLong(String key) {
    Object r = meta.get("response");
    if (!(r instanceof Map<?, ?> m)) return null;
    Object v = m.get(key);
    return (v instanceof Number n) ? n.longValue() : null;
  }
}

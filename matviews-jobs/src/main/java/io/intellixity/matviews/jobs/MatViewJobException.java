package io.intellixity.matviews.jobs;

import io.intellixity.matviews.error.MatViewsException;
import io.intellixity.matviews.response.ServiceResponse;

/**
 * Raised by a job after its run was persisted as failed, so the queue backend sees the failure too.
 * Carries the engine's error response when there is one.
 */
public final class MatViewJobException extends MatViewsException {
  private final transient ServiceResponse response;

  public MatViewJobException(String message) {
    super(message);
    this.response = null;
  }

  public MatViewJobException(String jobName, String viewName, ServiceResponse response) {
    super(jobName + " failed for " + viewName + ": " + describe(response));
    this.response = response;
  }

  /** Error response that caused the failure; null when the job failed before reaching the engine. */
  public ServiceResponse response() { return response; }

  private static String describe(ServiceResponse r) {
    if (r == null || r.error() == null) return "unknown error";
    return r.error().className() + ": " + r.error().message();
  }
}

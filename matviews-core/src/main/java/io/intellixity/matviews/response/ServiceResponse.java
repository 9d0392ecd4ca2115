package io.intellixity.matviews.response;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of one engine operation.
 * <p>
 * {@code error} is present iff {@code status == ERROR}; the canonical constructor rejects any other pairing.
 * {@code request} echoes the normalized options, {@code response} carries the operation payload.
 */
@JsonSerialize(using = ServiceResponseJsonSerializer.class)
public record ServiceResponse(ServiceStatus status,
                              Map<String, Object> request,
                              Map<String, Object> response,
                              ErrorDetails error) {
  public ServiceResponse {
    if (status == null) throw new IllegalArgumentException("status is required");
    if (status == ServiceStatus.ERROR && error == null) {
      throw new IllegalArgumentException("status=error requires error details");
    }
    if (status != ServiceStatus.ERROR && error != null) {
      throw new IllegalArgumentException("error details are only allowed with status=error, got " + status.id());
    }
    request = frozen(request);
    response = frozen(response);
  }

  public static ServiceResponse of(ServiceStatus status, Map<String, ?> request, Map<String, ?> response) {
    return new ServiceResponse(status, copy(request), copy(response), null);
  }

  public static ServiceResponse error(Throwable t, Map<String, ?> request, Map<String, ?> response) {
    return new ServiceResponse(ServiceStatus.ERROR, copy(request), copy(response), ErrorDetails.from(t));
  }

  public boolean isSuccess() { return status.isSuccess(); }

  public boolean isError() { return status == ServiceStatus.ERROR; }

  /** {@code {status, request, response, error}} with {@code error} omitted when absent. */
  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", status.id());
    m.put("request", request);
    m.put("response", response);
    if (error != null) m.put("error", error.toMap());
    return m;
  }

  /** {@code {request, response}} snapshot stored on run records. */
  public Map<String, Object> meta() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("request", request);
    m.put("response", response);
    return m;
  }

  private static Map<String, Object> copy(Map<String, ?> m) {
    return (m == null) ? null : new LinkedHashMap<>(m);
  }

  // Values may be null (e.g. a skipped drop has no statement), so Map.copyOf is not an option.
  private static Map<String, Object> frozen(Map<String, Object> m) {
    if (m == null || m.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(m)));
  }
}

package io.intellixity.matviews.response;

import java.util.Locale;

/** Outcome of one operation. Every status except {@link #ERROR} is a success. */
public enum ServiceStatus {
  OK,
  CREATED,
  UPDATED,
  SKIPPED,
  DELETED,
  ERROR;

  public boolean isSuccess() { return this != ERROR; }

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static ServiceStatus fromId(String id) {
    if (id == null) throw new IllegalArgumentException("status is required");
    return valueOf(id.trim().toUpperCase(Locale.ROOT));
  }
}

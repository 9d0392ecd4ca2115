package io.intellixity.matviews.jobs;

import java.util.Locale;

/** Available {@link JobAdapter} backends. */
public enum JobAdapterKind {
  /** Run on the caller's thread. */
  INLINE,
  /** Run on in-process per-queue thread pools. */
  EXECUTOR;

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static JobAdapterKind fromId(String id) {
    if (id == null || id.isBlank()) return INLINE;
    for (JobAdapterKind k : values()) {
      if (k.id().equalsIgnoreCase(id.trim())) return k;
    }
    throw new IllegalArgumentException("Unknown job adapter: " + id);
  }
}

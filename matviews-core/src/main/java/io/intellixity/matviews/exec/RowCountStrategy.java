package io.intellixity.matviews.exec;

import java.util.Locale;

/**
 * How operations measure view size before and after they run.
 * <p>
 * Unrecognized input resolves to {@link #NONE}, which reports {@link #UNKNOWN} without touching the database.
 */
public enum RowCountStrategy {
  /** No counting query; always {@link #UNKNOWN}. */
  NONE,

  /** {@code pg_class.reltuples}: cheap, may be stale. */
  ESTIMATED,

  /** {@code COUNT(*)}: exact, may be slow on large views. */
  EXACT;

  /** Sentinel reported when the count is not measured or the view no longer exists. */
  public static final long UNKNOWN = -1L;

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static RowCountStrategy from(Object raw) {
    if (raw instanceof RowCountStrategy s) return s;
    if (raw == null) return NONE;
    String v = String.valueOf(raw).trim();
    for (RowCountStrategy s : values()) {
      if (s.id().equalsIgnoreCase(v)) return s;
    }
    return NONE;
  }
}

package io.intellixity.matviews.definition;

import java.util.Locale;

/** How a definition's materialized view is refreshed. */
public enum RefreshStrategy {
  /** {@code REFRESH MATERIALIZED VIEW}: holds an exclusive lock, blocks readers while it runs. */
  REGULAR,

  /** {@code REFRESH MATERIALIZED VIEW CONCURRENTLY}: readers keep working, needs a unique index. */
  CONCURRENT,

  /** Build a replacement view and rename it into place in one short transaction. */
  SWAP;

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static RefreshStrategy fromId(String id) {
    if (id == null || id.isBlank()) return REGULAR;
    for (RefreshStrategy s : values()) {
      if (s.id().equalsIgnoreCase(id.trim())) return s;
    }
    throw new IllegalArgumentException("Unknown refresh strategy: " + id);
  }
}

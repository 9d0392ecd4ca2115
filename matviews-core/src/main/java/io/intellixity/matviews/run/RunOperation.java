package io.intellixity.matviews.run;

import java.util.Locale;

public enum RunOperation {
  CREATE,
  REFRESH,
  DROP;

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static RunOperation fromId(String id) {
    return valueOf(id.trim().toUpperCase(Locale.ROOT));
  }
}

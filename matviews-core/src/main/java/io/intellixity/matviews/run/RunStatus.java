package io.intellixity.matviews.run;

import java.util.Locale;

/** Run state machine: {@code RUNNING -> SUCCESS | FAILED}; terminal states have no exits. */
public enum RunStatus {
  RUNNING,
  SUCCESS,
  FAILED;

  public boolean isTerminal() { return this != RUNNING; }

  public boolean canTransitionTo(RunStatus next) {
    return this == RUNNING && next != null && next.isTerminal();
  }

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static RunStatus fromId(String id) {
    return valueOf(id.trim().toUpperCase(Locale.ROOT));
  }
}

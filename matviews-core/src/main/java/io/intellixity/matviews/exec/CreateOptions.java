package io.intellixity.matviews.exec;

/** @param force drop and rebuild an existing view instead of skipping */
public record CreateOptions(boolean force) {
  public static final CreateOptions DEFAULT = new CreateOptions(false);
}

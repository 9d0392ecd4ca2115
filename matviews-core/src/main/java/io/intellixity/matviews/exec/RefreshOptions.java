package io.intellixity.matviews.exec;

public record RefreshOptions(RowCountStrategy rowCountStrategy) {
  public static final RefreshOptions DEFAULT = new RefreshOptions(RowCountStrategy.ESTIMATED);

  public RefreshOptions {
    rowCountStrategy = (rowCountStrategy == null) ? RowCountStrategy.NONE : rowCountStrategy;
  }
}

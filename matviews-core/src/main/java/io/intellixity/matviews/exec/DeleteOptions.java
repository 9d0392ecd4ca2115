package io.intellixity.matviews.exec;

/**
 * @param cascade  {@code CASCADE} instead of {@code RESTRICT}
 * @param ifExists skip quietly when the view is absent; when false an absent view is an error
 */
public record DeleteOptions(boolean cascade, boolean ifExists, RowCountStrategy rowCountStrategy) {
  public static final DeleteOptions DEFAULT = new DeleteOptions(false, true, RowCountStrategy.NONE);

  public DeleteOptions {
    rowCountStrategy = (rowCountStrategy == null) ? RowCountStrategy.NONE : rowCountStrategy;
  }

  public static DeleteOptions cascade(boolean cascade) {
    return new DeleteOptions(cascade, true, RowCountStrategy.NONE);
  }
}

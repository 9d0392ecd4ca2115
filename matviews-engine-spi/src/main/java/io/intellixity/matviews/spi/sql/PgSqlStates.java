package io.intellixity.matviews.spi.sql;

/** SQLSTATE codes the operations classify. */
public final class PgSqlStates {
  private PgSqlStates() {}

  public static final String OBJECT_IN_USE = "55006";
  public static final String LOCK_NOT_AVAILABLE = "55P03";
  public static final String DEPENDENT_OBJECTS_STILL_EXIST = "2BP01";
  public static final String DUPLICATE_TABLE = "42P07";
  public static final String UNDEFINED_TABLE = "42P01";
  public static final String ACTIVE_SQL_TRANSACTION = "25001";
}

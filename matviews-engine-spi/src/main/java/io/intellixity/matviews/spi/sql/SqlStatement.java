package io.intellixity.matviews.spi.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One SQL statement plus positional ({@code ?}) parameters.
 * <p>
 * Built only by {@link MatViewSql}; identifiers are already quoted in {@code sql}, values travel as params.
 */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = (params == null || params.isEmpty()) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public SqlStatement(String sql) {
    this(sql, List.of());
  }

  public static SqlStatement of(String sql, Object... params) {
    return new SqlStatement(sql, List.of(params));
  }

  @Override
  public String toString() { return sql; }
}

package io.intellixity.matviews.definition;

import io.intellixity.matviews.error.DefinitionValidationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Declared materialized view.
 * <p>
 * Immutable; operations read it and never change it. {@code dependencies} and {@code schedule} are
 * informational and are not interpreted by the engine.
 */
public record MatViewDefinition(Long id,
                                String name,
                                String sql,
                                RefreshStrategy refreshStrategy,
                                List<String> uniqueIndexColumns,
                                List<String> dependencies,
                                String schedule) {
  public static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  public MatViewDefinition {
    refreshStrategy = (refreshStrategy == null) ? RefreshStrategy.REGULAR : refreshStrategy;
    uniqueIndexColumns = normalizeColumns(uniqueIndexColumns);
    dependencies = (dependencies == null) ? List.of() : List.copyOf(dependencies);
    schedule = (schedule == null || schedule.isBlank()) ? null : schedule.trim();
  }

  public static MatViewDefinition of(String name, String sql, RefreshStrategy strategy, List<String> uniqueIndexColumns) {
    return new MatViewDefinition(null, name, sql, strategy, uniqueIndexColumns, List.of(), null);
  }

  public MatViewDefinition withId(long newId) {
    return new MatViewDefinition(newId, name, sql, refreshStrategy, uniqueIndexColumns, dependencies, schedule);
  }

  public static boolean isValidName(String name) {
    return name != null && NAME_PATTERN.matcher(name).matches();
  }

  public static boolean isSelectSql(String sql) {
    return sql != null && sql.strip().toUpperCase(Locale.ROOT).startsWith("SELECT");
  }

  public boolean hasValidName() { return isValidName(name); }

  public boolean hasSelectSql() { return isSelectSql(sql); }

  public boolean missingConcurrentColumns() {
    return refreshStrategy == RefreshStrategy.CONCURRENT && uniqueIndexColumns.isEmpty();
  }

  /** All violations, in a stable order; empty when the definition is usable. */
  public List<String> validate() {
    List<String> out = new ArrayList<>();
    if (!hasValidName()) out.add("Invalid view name format: " + quoted(name));
    if (!hasSelectSql()) out.add("SQL must start with SELECT");
    if (missingConcurrentColumns()) {
      out.add("refresh_strategy=concurrent requires unique_index_columns (non-empty)");
    }
    return out;
  }

  public MatViewDefinition requireValid() {
    List<String> violations = validate();
    if (!violations.isEmpty()) throw new DefinitionValidationException(violations);
    return this;
  }

  static String quoted(String s) {
    return (s == null) ? "null" : "\"" + s + "\"";
  }

  private static List<String> normalizeColumns(List<String> cols) {
    if (cols == null || cols.isEmpty()) return List.of();
    LinkedHashSet<String> uniq = new LinkedHashSet<>();
    for (String c : cols) {
      if (c == null) continue;
      String t = c.trim();
      if (!t.isEmpty()) uniq.add(t);
    }
    return List.copyOf(uniq);
  }
}

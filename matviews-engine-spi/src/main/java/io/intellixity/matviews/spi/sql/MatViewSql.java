package io.intellixity.matviews.spi.sql;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * The only place where lifecycle SQL is assembled.
 * <p>
 * Identifiers (schema, relation, index, column) are always double-quoted through {@link #quoteIdent};
 * catalog lookups take their values as bind parameters. The definition's SELECT body is the one piece of
 * text spliced verbatim, since it is the view's defining query.
 */
public final class MatViewSql {
  /** PostgreSQL's NAMEDATALEN - 1; longer identifiers are silently truncated by the server. */
  public static final int MAX_IDENT_BYTES = 63;
  private static final int HASH_HEX = 8;

  private MatViewSql() {}

  public static String quoteIdent(String ident) {
    Objects.requireNonNull(ident, "ident");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  // ---------------------------------------------------------------------------
  // catalog
  // ---------------------------------------------------------------------------

  public static SqlStatement showSearchPath() {
    return new SqlStatement("SHOW search_path");
  }

  public static SqlStatement currentUser() {
    return new SqlStatement("SELECT current_user");
  }

  public static SqlStatement schemaExists(String schema) {
    return SqlStatement.of("SELECT EXISTS (SELECT 1 FROM pg_namespace WHERE nspname = ?)", schema);
  }

  public static SqlStatement matViewExists(QualifiedName q) {
    return SqlStatement.of(
        "SELECT COUNT(*) FROM pg_matviews WHERE schemaname = ? AND matviewname = ?",
        q.schema(), q.name());
  }

  public static SqlStatement uniqueIndexCount(QualifiedName q) {
    return SqlStatement.of(
        "SELECT COUNT(*) FROM pg_index i"
            + " JOIN pg_class c ON c.oid = i.indrelid"
            + " JOIN pg_namespace n ON n.oid = c.relnamespace"
            + " WHERE n.nspname = ? AND c.relname = ? AND i.indisunique = TRUE",
        q.schema(), q.name());
  }

  public static SqlStatement estimatedRowCount(QualifiedName q) {
    return SqlStatement.of(
        "SELECT COALESCE(c.reltuples::bigint, 0) FROM pg_class c"
            + " JOIN pg_namespace n ON n.oid = c.relnamespace"
            + " WHERE c.relkind IN ('m','r','p') AND n.nspname = ? AND c.relname = ?"
            + " LIMIT 1",
        q.schema(), q.name());
  }

  public static SqlStatement exactRowCount(QualifiedName q) {
    return new SqlStatement("SELECT COUNT(*) FROM " + q.quoted());
  }

  // ---------------------------------------------------------------------------
  // DDL
  // ---------------------------------------------------------------------------

  public static SqlStatement createMatView(QualifiedName q, String selectSql) {
    return new SqlStatement("CREATE MATERIALIZED VIEW " + q.quoted() + " AS " + body(selectSql) + " WITH DATA");
  }

  public static SqlStatement refresh(QualifiedName q, boolean concurrently) {
    return new SqlStatement("REFRESH MATERIALIZED VIEW " + (concurrently ? "CONCURRENTLY " : "") + q.quoted());
  }

  /** {@code DROP ... IF EXISTS} with the server's default behavior (RESTRICT). */
  public static SqlStatement dropIfExists(QualifiedName q) {
    return new SqlStatement("DROP MATERIALIZED VIEW IF EXISTS " + q.quoted());
  }

  public static SqlStatement dropIfExists(QualifiedName q, boolean cascade) {
    return new SqlStatement("DROP MATERIALIZED VIEW IF EXISTS " + q.quoted() + (cascade ? " CASCADE" : " RESTRICT"));
  }

  public static SqlStatement drop(QualifiedName q) {
    return new SqlStatement("DROP MATERIALIZED VIEW " + q.quoted());
  }

  public static SqlStatement rename(QualifiedName q, String newName) {
    return new SqlStatement("ALTER MATERIALIZED VIEW " + q.quoted() + " RENAME TO " + quoteIdent(newName));
  }

  public static SqlStatement createUniqueIndex(String indexName, QualifiedName q, List<String> columns, boolean concurrently) {
    if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("unique index needs at least one column");
    StringJoiner cols = new StringJoiner(", ");
    for (String c : columns) cols.add(quoteIdent(c));
    return new SqlStatement("CREATE UNIQUE INDEX " + (concurrently ? "CONCURRENTLY " : "")
        + quoteIdent(indexName) + " ON " + q.quoted() + " (" + cols + ")");
  }

  /**
   * {@code <schema>_<rel>_uniq_<col1>_<col2>...}; shared by create and swap so the name stays stable.\n
   * Names over {@link #MAX_IDENT_BYTES} are cut and tagged with a hash of the full name (see {@link #fitIdentifier}).
   */
  public static String uniqueIndexName(QualifiedName q, List<String> columns) {
    StringJoiner j = new StringJoiner("_");
    j.add(q.schema()).add(q.name()).add("uniq");
    for (String c : columns) j.add(c);
    return fitIdentifier(j.toString());
  }

  /**
   * Returns {@code name} unchanged when it fits in {@link #MAX_IDENT_BYTES} UTF-8 bytes; otherwise its longest
   * fitting prefix followed by {@code _} and 8 hex chars of the SHA-256 of the full name.
   */
  public static String fitIdentifier(String name) {
    Objects.requireNonNull(name, "name");
    if (name.getBytes(StandardCharsets.UTF_8).length <= MAX_IDENT_BYTES) return name;
    String tag = "_" + shortHash(name);
    int room = MAX_IDENT_BYTES - tag.length();
    StringBuilder prefix = new StringBuilder();
    int used = 0;
    for (int i = 0; i < name.length(); ) {
      int cp = name.codePointAt(i);
      int len = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
      if (used + len > room) break;
      prefix.appendCodePoint(cp);
      used += len;
      i += Character.charCount(cp);
    }
    return prefix + tag;
  }

  private static String shortHash(String s) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest, 0, HASH_HEX / 2);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  // Trailing semicolons would end the statement before WITH DATA.
  static String body(String selectSql) {
    Objects.requireNonNull(selectSql, "selectSql");
    String s = selectSql.strip();
    while (s.endsWith(";")) s = s.substring(0, s.length() - 1).stripTrailing();
    return s;
  }
}

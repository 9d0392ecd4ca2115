package io.intellixity.matviews.spi.sql;

import java.util.Objects;

/** Schema-qualified relation name. */
public record QualifiedName(String schema, String name) {
  public QualifiedName {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(name, "name");
  }

  /** {@code "schema"."name"}, safe to splice into DDL. */
  public String quoted() {
    return MatViewSql.quoteIdent(schema) + "." + MatViewSql.quoteIdent(name);
  }

  /** Same schema, different relation name. */
  public QualifiedName sibling(String otherName) {
    return new QualifiedName(schema, otherName);
  }

  /** {@code schema.name}, as reported in responses. */
  @Override
  public String toString() { return schema + "." + name; }
}

package io.intellixity.reltab.jdbc.postgres;

import io.intellixity.reltab.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.reltab.query.OffsetPage;
import io.intellixity.reltab.schema.ColumnType;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides. Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String sqlType(ColumnType type) {
    return type == ColumnType.TEXT ? "TEXT" : super.sqlType(type);
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " LIMIT " + page.limit() + " OFFSET " + page.offset();
  }
}

package io.intellixity.reltab.query;

import io.intellixity.reltab.expr.Expr;
import io.intellixity.reltab.expr.ExprTypeException;
import io.intellixity.reltab.expr.Exprs;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Shared parameter validation for query nodes. */
final class QueryChecks {
  private QueryChecks() {}

  static void requireColumn(Schema schema, String column, String usage) {
    if (column == null || !schema.hasColumn(column)) {
      throw new QueryBuildException(usage + ": unknown column '" + column + "' (columns: " + schema.columns() + ")");
    }
  }

  static void requireColumns(Schema schema, Collection<String> columns, String usage) {
    for (String c : columns) requireColumn(schema, c, usage);
  }

  static void requireDistinct(List<String> columns, String usage) {
    Set<String> seen = new HashSet<>();
    for (String c : columns) {
      if (!seen.add(c)) throw new QueryBuildException(usage + ": duplicate column '" + c + "'");
    }
  }

  static void requireNewColumn(Schema schema, String column, String usage) {
    if (column == null || column.isEmpty()) throw new QueryBuildException(usage + ": blank column id");
    if (schema.hasColumn(column)) {
      throw new QueryBuildException(usage + ": column '" + column + "' already exists (columns: " + schema.columns() + ")");
    }
  }

  static void requireSortKeys(Schema schema, List<SortKey> keys, String usage) {
    if (keys.isEmpty()) throw new QueryBuildException(usage + ": empty key list");
    Set<String> seen = new HashSet<>();
    for (SortKey k : keys) {
      Objects.requireNonNull(k, "sort key");
      requireColumn(schema, k.column(), usage);
      if (!seen.add(k.column())) throw new QueryBuildException(usage + ": duplicate key column '" + k.column() + "'");
    }
  }

  /** Type of {@code e} over {@code schema}; unknown columns are build errors, type mismatches stay type errors. */
  static ColumnType typeOf(Expr e, Schema schema, String usage) {
    for (String c : Exprs.referencedColumns(e)) requireColumn(schema, c, usage);
    ColumnType t = e.typeIn(schema);
    if (t == null) throw new ExprTypeException(usage + ": cannot determine type of " + e);
    return t;
  }
}

package io.intellixity.reltab.expr;

import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.Objects;

public final class ColumnRef implements Expr {
  private final String columnId;

  public ColumnRef(String columnId) {
    this.columnId = Objects.requireNonNull(columnId, "columnId");
  }

  public String columnId() { return columnId; }

  @Override
  public ColumnType typeIn(Schema schema) {
    if (!schema.hasColumn(columnId)) {
      throw new ExprTypeException("Unknown column '" + columnId + "' in expression (columns: " + schema.columns() + ")");
    }
    return schema.columnType(columnId);
  }

  @Override
  public ColumnType staticType() { return null; }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof ColumnRef r && r.columnId.equals(columnId);
  }

  @Override
  public int hashCode() { return columnId.hashCode(); }

  @Override
  public String toString() { return "col(" + columnId + ")"; }
}

package io.intellixity.reltab.query;

import io.intellixity.reltab.expr.Expr;
import io.intellixity.reltab.expr.ExprTypeException;
import io.intellixity.reltab.schema.ColumnMetadata;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

/** Append one derived column computed from {@code value} over each row. */
public final class ExtendQuery implements QueryExp {
  private final QueryExp from;
  private final String columnId;
  private final ColumnMetadata metadata;
  private final Expr value;
  private final Schema schema;

  public ExtendQuery(QueryExp from, String columnId, ColumnMetadata metadata, Expr value) {
    this.from = Objects.requireNonNull(from, "from");
    Objects.requireNonNull(metadata, "metadata");
    this.value = Objects.requireNonNull(value, "value");
    Schema in = from.schema();
    QueryChecks.requireNewColumn(in, columnId, "extend");
    this.columnId = columnId;
    this.metadata = metadata.displayName() == null ? metadata.withDisplayName(columnId) : metadata;
    ColumnType actual = QueryChecks.typeOf(value, in, "extend");
    ColumnType declared = metadata.type();
    if (actual != declared && !(declared == ColumnType.REAL && actual == ColumnType.INTEGER)) {
      throw new ExprTypeException("extend: column '" + columnId + "' declared " + declared.id()
          + " but expression is " + actual.id() + ": " + value);
    }
    this.schema = Schema.builder()
        .columns(in)
        .column(columnId, declared, this.metadata.displayName())
        .build();
  }

  public QueryExp from() { return from; }
  public String columnId() { return columnId; }
  public ColumnMetadata metadata() { return metadata; }
  public Expr value() { return value; }

  @Override public String operator() { return "extend"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof ExtendQuery e && e.from.equals(from) && e.columnId.equals(columnId)
        && e.metadata.equals(metadata) && e.value.equals(value);
  }

  @Override
  public int hashCode() { return Objects.hash(from, columnId, metadata, value); }

  @Override
  public String toString() { return from + ".extend(" + columnId + ", " + value + ")"; }
}

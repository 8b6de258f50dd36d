package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

public final class ProjectQuery implements QueryExp {
  private final QueryExp from;
  private final List<String> columns;
  private final Schema schema;

  public ProjectQuery(QueryExp from, List<String> columns) {
    this.from = Objects.requireNonNull(from, "from");
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (this.columns.isEmpty()) throw new QueryBuildException("project: empty column list");
    Schema in = from.schema();
    QueryChecks.requireColumns(in, this.columns, "project");
    QueryChecks.requireDistinct(this.columns, "project");
    Schema.Builder b = Schema.builder();
    for (String c : this.columns) b.column(c, in.columnType(c), in.displayName(c));
    this.schema = b.build();
  }

  public QueryExp from() { return from; }
  public List<String> columns() { return columns; }

  @Override public String operator() { return "project"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof ProjectQuery p && p.from.equals(from) && p.columns.equals(columns);
  }

  @Override
  public int hashCode() { return Objects.hash(from, columns); }

  @Override
  public String toString() { return from + ".project(" + columns + ")"; }
}

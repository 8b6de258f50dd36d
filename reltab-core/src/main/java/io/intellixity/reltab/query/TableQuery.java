package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

/** Leaf node: every row of a named table in the backing engine. */
public final class TableQuery implements QueryExp {
  private final String tableName;
  private final Schema schema;

  public TableQuery(String tableName, Schema schema) {
    if (tableName == null || tableName.isBlank()) throw new QueryBuildException("table: blank table name");
    this.tableName = tableName;
    this.schema = Objects.requireNonNull(schema, "schema");
    if (schema.size() == 0) throw new QueryBuildException("table '" + tableName + "': schema has no columns");
  }

  public String tableName() { return tableName; }

  @Override public String operator() { return "table"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof TableQuery t && t.tableName.equals(tableName) && t.schema.equals(schema);
  }

  @Override
  public int hashCode() { return Objects.hash(tableName, schema); }

  @Override
  public String toString() { return "table(" + tableName + ")"; }
}

package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Append an integer column numbering rows 1..n in {@code keys} order.
 *
 * <p>Unlike {@link SortQuery}, the ordering survives further composition (joins, unions) because it is
 * carried as data.</p>
 */
public final class RowNumberQuery implements QueryExp {
  private final QueryExp from;
  private final String columnId;
  private final List<SortKey> keys;
  private final Schema schema;

  public RowNumberQuery(QueryExp from, String columnId, List<SortKey> keys) {
    this.from = Objects.requireNonNull(from, "from");
    this.keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    Schema in = from.schema();
    QueryChecks.requireNewColumn(in, columnId, "rowNumber");
    QueryChecks.requireSortKeys(in, this.keys, "rowNumber");
    this.columnId = columnId;
    this.schema = Schema.builder().columns(in).column(columnId, ColumnType.INTEGER).build();
  }

  public QueryExp from() { return from; }
  public String columnId() { return columnId; }
  public List<SortKey> keys() { return keys; }

  @Override public String operator() { return "rowNumber"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof RowNumberQuery r && r.from.equals(from) && r.columnId.equals(columnId) && r.keys.equals(keys);
  }

  @Override
  public int hashCode() { return Objects.hash(from, columnId, keys); }

  @Override
  public String toString() { return from + ".rowNumber(" + columnId + ", " + keys + ")"; }
}

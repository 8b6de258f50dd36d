package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Group rows by {@code groupColumns}; the schema is the group columns followed by one column per aggregate,
 * named after the aggregated column. Aggregates without an explicit function are resolved to the column
 * type's default here, so {@link #aggs()} always carries explicit functions.
 */
public final class GroupByQuery implements QueryExp {
  private final QueryExp from;
  private final List<String> groupColumns;
  private final List<AggSpec> aggs;
  private final Schema schema;

  public GroupByQuery(QueryExp from, List<String> groupColumns, List<AggSpec> aggs) {
    this.from = Objects.requireNonNull(from, "from");
    this.groupColumns = List.copyOf(Objects.requireNonNull(groupColumns, "groupColumns"));
    Objects.requireNonNull(aggs, "aggs");
    Schema in = from.schema();
    QueryChecks.requireColumns(in, this.groupColumns, "groupBy");

    Schema.Builder b = Schema.builder();
    for (String g : this.groupColumns) b.column(g, in.columnType(g), in.displayName(g));

    List<AggSpec> resolved = new ArrayList<>(aggs.size());
    for (AggSpec a : aggs) {
      Objects.requireNonNull(a, "agg");
      QueryChecks.requireColumn(in, a.column(), "groupBy aggregate");
      ColumnType t = in.columnType(a.column());
      AggFn fn = (a.fn() == null) ? AggFn.defaultFor(t) : a.fn();
      if (!fn.accepts(t)) {
        throw new QueryBuildException("groupBy: " + fn.id() + " cannot aggregate " + t.id() + " column '" + a.column() + "'");
      }
      resolved.add(AggSpec.of(fn, a.column()));
    }
    this.aggs = List.copyOf(resolved);

    List<String> out = new ArrayList<>(this.groupColumns);
    for (AggSpec a : this.aggs) out.add(a.column());
    QueryChecks.requireDistinct(out, "groupBy");
    for (AggSpec a : this.aggs) {
      b.column(a.column(), a.fn().resultType(in.columnType(a.column())), in.displayName(a.column()));
    }
    this.schema = b.build();
  }

  public QueryExp from() { return from; }
  public List<String> groupColumns() { return groupColumns; }
  public List<AggSpec> aggs() { return aggs; }

  @Override public String operator() { return "groupBy"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof GroupByQuery g && g.from.equals(from) && g.groupColumns.equals(groupColumns) && g.aggs.equals(aggs);
  }

  @Override
  public int hashCode() { return Objects.hash(from, groupColumns, aggs); }

  @Override
  public String toString() { return from + ".groupBy(" + groupColumns + ", " + aggs + ")"; }
}

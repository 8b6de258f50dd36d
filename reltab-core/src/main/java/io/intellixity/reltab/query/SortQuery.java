package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

/** Multi-key sort; earlier keys take precedence. */
public final class SortQuery implements QueryExp {
  private final QueryExp from;
  private final List<SortKey> keys;

  public SortQuery(QueryExp from, List<SortKey> keys) {
    this.from = Objects.requireNonNull(from, "from");
    this.keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    QueryChecks.requireSortKeys(from.schema(), this.keys, "sort");
  }

  public QueryExp from() { return from; }
  public List<SortKey> keys() { return keys; }

  @Override public String operator() { return "sort"; }
  @Override public Schema schema() { return from.schema(); }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof SortQuery s && s.from.equals(from) && s.keys.equals(keys);
  }

  @Override
  public int hashCode() { return Objects.hash(from, keys); }

  @Override
  public String toString() { return from + ".sort(" + keys + ")"; }
}

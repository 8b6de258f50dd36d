package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Equi-join on shared key columns; null keys match each other. The schema is the key columns once (left
 * side metadata), then the left side's remaining columns, then the right side's remaining columns.
 */
public final class JoinQuery implements QueryExp {
  private final QueryExp left;
  private final QueryExp right;
  private final List<String> on;
  private final JoinType joinType;
  private final Schema schema;

  public JoinQuery(QueryExp left, QueryExp right, List<String> on, JoinType joinType) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
    this.on = List.copyOf(Objects.requireNonNull(on, "on"));
    this.joinType = (joinType == null) ? JoinType.LEFT_OUTER : joinType;
    if (this.on.isEmpty()) throw new QueryBuildException("join: empty key column list");
    Schema ls = left.schema();
    Schema rs = right.schema();
    QueryChecks.requireColumns(ls, this.on, "join (left)");
    QueryChecks.requireColumns(rs, this.on, "join (right)");
    QueryChecks.requireDistinct(this.on, "join");
    for (String k : this.on) {
      if (ls.columnType(k) != rs.columnType(k)) {
        throw new QueryBuildException("join: key '" + k + "' is " + ls.columnType(k).id()
            + " on the left but " + rs.columnType(k).id() + " on the right");
      }
    }

    Schema.Builder b = Schema.builder();
    for (String k : this.on) b.column(k, ls.columnType(k), ls.displayName(k));
    for (String c : ls.columns()) {
      if (!this.on.contains(c)) b.column(c, ls.columnType(c), ls.displayName(c));
    }
    for (String c : rs.columns()) {
      if (this.on.contains(c)) continue;
      if (ls.hasColumn(c)) {
        throw new QueryBuildException("join: non-key column '" + c + "' appears on both sides");
      }
      b.column(c, rs.columnType(c), rs.displayName(c));
    }
    this.schema = b.build();
  }

  public QueryExp left() { return left; }
  public QueryExp right() { return right; }
  public List<String> on() { return on; }
  public JoinType joinType() { return joinType; }

  @Override public String operator() { return "join"; }
  @Override public Schema schema() { return schema; }
  @Override public List<QueryExp> children() { return List.of(left, right); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof JoinQuery j && j.left.equals(left) && j.right.equals(right)
        && j.on.equals(on) && j.joinType == joinType;
  }

  @Override
  public int hashCode() { return Objects.hash(left, right, on, joinType); }

  @Override
  public String toString() { return left + ".join(" + right + ", " + on + ", " + joinType.id() + ")"; }
}

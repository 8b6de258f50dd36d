package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

/** All rows of {@code left} followed by all rows of {@code right}; duplicates are kept. */
public final class ConcatQuery implements QueryExp {
  private final QueryExp left;
  private final QueryExp right;

  public ConcatQuery(QueryExp left, QueryExp right) {
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
    if (!left.schema().isCompatibleWith(right.schema())) {
      throw new QueryBuildException("concat: schemas differ: " + left.schema() + " vs " + right.schema());
    }
  }

  public QueryExp left() { return left; }
  public QueryExp right() { return right; }

  @Override public String operator() { return "concat"; }
  @Override public Schema schema() { return left.schema(); }
  @Override public List<QueryExp> children() { return List.of(left, right); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof ConcatQuery c && c.left.equals(left) && c.right.equals(right);
  }

  @Override
  public int hashCode() { return Objects.hash(left, right); }

  @Override
  public String toString() { return left + ".concat(" + right + ")"; }
}

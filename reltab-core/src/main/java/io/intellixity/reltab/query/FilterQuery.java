package io.intellixity.reltab.query;

import io.intellixity.reltab.expr.Expr;
import io.intellixity.reltab.expr.ExprTypeException;
import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.List;
import java.util.Objects;

public final class FilterQuery implements QueryExp {
  private final QueryExp from;
  private final Expr predicate;

  public FilterQuery(QueryExp from, Expr predicate) {
    this.from = Objects.requireNonNull(from, "from");
    this.predicate = Objects.requireNonNull(predicate, "predicate");
    ColumnType t = QueryChecks.typeOf(predicate, from.schema(), "filter");
    if (t != ColumnType.BOOLEAN) {
      throw new ExprTypeException("filter: predicate must be boolean, got " + t.id() + ": " + predicate);
    }
  }

  public QueryExp from() { return from; }
  public Expr predicate() { return predicate; }

  @Override public String operator() { return "filter"; }
  @Override public Schema schema() { return from.schema(); }
  @Override public List<QueryExp> children() { return List.of(from); }
  @Override public <R> R accept(QueryExpVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof FilterQuery f && f.from.equals(from) && f.predicate.equals(predicate);
  }

  @Override
  public int hashCode() { return Objects.hash(from, predicate); }

  @Override
  public String toString() { return from + ".filter(" + predicate + ")"; }
}

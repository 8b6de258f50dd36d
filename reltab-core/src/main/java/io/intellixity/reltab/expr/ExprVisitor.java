package io.intellixity.reltab.expr;

public interface ExprVisitor<R> {
  R visit(ColumnRef ref);
  R visit(Const c);
  R visit(Combinator c);
}

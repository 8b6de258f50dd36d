package io.intellixity.reltab.expr;

import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Operator applied to one or more operand expressions. */
public final class Combinator implements Expr {
  private final ExprOp op;
  private final List<Expr> operands;
  private final ColumnType staticType;

  /**
   * @throws ExprTypeException on a wrong operand count or operand types already known to be incompatible
   */
  public Combinator(ExprOp op, List<Expr> operands) {
    this.op = Objects.requireNonNull(op, "op");
    this.operands = List.copyOf(Objects.requireNonNull(operands, "operands"));
    List<ColumnType> known = new ArrayList<>(this.operands.size());
    for (Expr e : this.operands) known.add(e.staticType());
    this.staticType = op.resultType(known);
  }

  public ExprOp op() { return op; }
  public List<Expr> operands() { return operands; }

  @Override
  public ColumnType typeIn(Schema schema) {
    List<ColumnType> types = new ArrayList<>(operands.size());
    for (Expr e : operands) types.add(e.typeIn(schema));
    return op.resultType(types);
  }

  @Override
  public ColumnType staticType() { return staticType; }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof Combinator c && c.op == op && c.operands.equals(operands);
  }

  @Override
  public int hashCode() { return Objects.hash(op, operands); }

  @Override
  public String toString() { return op.id() + operands; }
}

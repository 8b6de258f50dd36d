package io.intellixity.reltab.expr;

import io.intellixity.reltab.schema.ColumnType;
import io.intellixity.reltab.schema.Schema;

import java.util.Objects;

/** Typed constant. The value is held in the canonical Java form of its type (Long, Double, String, Boolean). */
public final class Const implements Expr {
  private final Object value;
  private final ColumnType type;

  public Const(Object value, ColumnType type) {
    this.type = Objects.requireNonNull(type, "type");
    try {
      this.value = type.coerce(value);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new ExprTypeException("Constant " + value + " does not fit type " + type.id() + ": " + e.getMessage());
    }
    if (this.value instanceof Double d && !Double.isFinite(d)) {
      throw new ExprTypeException("Constant " + d + " is not a finite real");
    }
  }

  public Object value() { return value; }
  public ColumnType type() { return type; }

  @Override
  public ColumnType typeIn(Schema schema) { return type; }

  @Override
  public ColumnType staticType() { return type; }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof Const c && c.type == type && Objects.equals(c.value, value);
  }

  @Override
  public int hashCode() { return Objects.hash(value, type); }

  @Override
  public String toString() { return "const(" + value + ":" + type.id() + ")"; }
}

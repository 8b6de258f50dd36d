package io.intellixity.reltab.expr;

import io.intellixity.reltab.schema.ColumnType;

import java.util.*;

/** Static builders for {@link Expr} trees. */
public final class Exprs {
  private Exprs() {}

  public static ColumnRef col(String columnId) { return new ColumnRef(columnId); }

  /** Constant whose type is inferred from the Java value. */
  public static Const constVal(Object value) {
    if (value == null) throw new ExprTypeException("Null constant needs an explicit type");
    return new Const(value, inferType(value));
  }

  public static Const constVal(Object value, ColumnType type) { return new Const(value, type); }

  public static Const nullOf(ColumnType type) { return new Const(null, type); }

  public static Combinator and(Expr... operands) { return new Combinator(ExprOp.AND, List.of(operands)); }
  public static Combinator or(Expr... operands) { return new Combinator(ExprOp.OR, List.of(operands)); }
  public static Combinator not(Expr operand) { return new Combinator(ExprOp.NOT, List.of(operand)); }

  public static Combinator eq(Expr a, Expr b) { return binary(ExprOp.EQ, a, b); }
  public static Combinator ne(Expr a, Expr b) { return binary(ExprOp.NE, a, b); }
  public static Combinator lt(Expr a, Expr b) { return binary(ExprOp.LT, a, b); }
  public static Combinator le(Expr a, Expr b) { return binary(ExprOp.LE, a, b); }
  public static Combinator gt(Expr a, Expr b) { return binary(ExprOp.GT, a, b); }
  public static Combinator ge(Expr a, Expr b) { return binary(ExprOp.GE, a, b); }

  /** Shorthand for {@code eq(col(columnId), constVal(value))}. */
  public static Combinator eq(String columnId, Object value) { return eq(col(columnId), constVal(value)); }

  public static Combinator isNull(Expr e) { return new Combinator(ExprOp.IS_NULL, List.of(e)); }
  public static Combinator isNotNull(Expr e) { return new Combinator(ExprOp.IS_NOT_NULL, List.of(e)); }
  public static Combinator like(Expr e, String pattern) { return binary(ExprOp.LIKE, e, constVal(pattern)); }

  public static Combinator add(Expr a, Expr b) { return binary(ExprOp.ADD, a, b); }
  public static Combinator sub(Expr a, Expr b) { return binary(ExprOp.SUB, a, b); }
  public static Combinator mul(Expr a, Expr b) { return binary(ExprOp.MUL, a, b); }
  public static Combinator div(Expr a, Expr b) { return binary(ExprOp.DIV, a, b); }

  public static Combinator toText(Expr e) { return new Combinator(ExprOp.TO_TEXT, List.of(e)); }

  /** Column ids referenced anywhere in {@code e}, in first-seen order. */
  public static Set<String> referencedColumns(Expr e) {
    Set<String> out = new LinkedHashSet<>();
    e.accept(new ExprVisitor<Void>() {
      @Override public Void visit(ColumnRef ref) { out.add(ref.columnId()); return null; }
      @Override public Void visit(Const c) { return null; }
      @Override public Void visit(Combinator c) {
        for (Expr x : c.operands()) x.accept(this);
        return null;
      }
    });
    return out;
  }

  static ColumnType inferType(Object v) {
    if (v instanceof CharSequence) return ColumnType.TEXT;
    if (v instanceof Boolean) return ColumnType.BOOLEAN;
    if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) return ColumnType.INTEGER;
    if (v instanceof Number) return ColumnType.REAL;
    throw new ExprTypeException("Cannot infer column type of constant " + v + " (" + v.getClass().getName() + ")");
  }

  private static Combinator binary(ExprOp op, Expr a, Expr b) {
    return new Combinator(op, List.of(a, b));
  }
}

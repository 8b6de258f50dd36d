package io.intellixity.reltab.expr;

import io.intellixity.reltab.schema.ColumnType;

import java.util.List;
import java.util.Locale;

public enum ExprOp {
  AND(Kind.BOOLEAN, 1, Integer.MAX_VALUE),
  OR(Kind.BOOLEAN, 1, Integer.MAX_VALUE),
  NOT(Kind.BOOLEAN, 1, 1),

  EQ(Kind.COMPARISON, 2, 2),
  NE(Kind.COMPARISON, 2, 2),
  LT(Kind.COMPARISON, 2, 2),
  LE(Kind.COMPARISON, 2, 2),
  GT(Kind.COMPARISON, 2, 2),
  GE(Kind.COMPARISON, 2, 2),

  IS_NULL(Kind.NULL_CHECK, 1, 1),
  IS_NOT_NULL(Kind.NULL_CHECK, 1, 1),
  LIKE(Kind.PATTERN, 2, 2),

  ADD(Kind.ARITHMETIC, 2, 2),
  SUB(Kind.ARITHMETIC, 2, 2),
  MUL(Kind.ARITHMETIC, 2, 2),
  DIV(Kind.ARITHMETIC, 2, 2),

  TO_TEXT(Kind.CONVERSION, 1, 1);

  enum Kind { BOOLEAN, COMPARISON, NULL_CHECK, PATTERN, ARITHMETIC, CONVERSION }

  private final Kind kind;
  private final int minArity;
  private final int maxArity;

  ExprOp(Kind kind, int minArity, int maxArity) {
    this.kind = kind;
    this.minArity = minArity;
    this.maxArity = maxArity;
  }

  /** External id used in the serialized form ("and", "isNull", "toText", ...). */
  public String id() {
    String[] parts = name().toLowerCase(Locale.ROOT).split("_");
    StringBuilder sb = new StringBuilder(parts[0]);
    for (int i = 1; i < parts.length; i++) {
      sb.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
    }
    return sb.toString();
  }

  public static ExprOp fromId(String id) {
    for (ExprOp op : values()) {
      if (op.id().equals(id) || op.name().equalsIgnoreCase(id)) return op;
    }
    throw new ExprTypeException("Unknown expression operator: '" + id + "'");
  }

  public boolean isComparison() { return kind == Kind.COMPARISON; }

  void checkArity(int n) {
    if (n < minArity || n > maxArity) {
      String expected = (minArity == maxArity) ? String.valueOf(minArity) : "at least " + minArity;
      throw new ExprTypeException(id() + " expects " + expected + " operand(s), got " + n);
    }
  }

  /**
   * Result type for the given operand types; a null entry is an operand whose type is not yet known.
   * Returns null when the result depends on unknown operands.
   *
   * @throws ExprTypeException when known operand types do not fit this operator
   */
  ColumnType resultType(List<ColumnType> operands) {
    checkArity(operands.size());
    switch (kind) {
      case BOOLEAN -> {
        for (ColumnType t : operands) requireType(t, ColumnType.BOOLEAN);
        return ColumnType.BOOLEAN;
      }
      case COMPARISON -> {
        ColumnType a = operands.get(0);
        ColumnType b = operands.get(1);
        if (a != null && b != null && ColumnType.widen(a, b) == null) {
          throw new ExprTypeException(id() + " cannot compare " + a.id() + " with " + b.id());
        }
        return ColumnType.BOOLEAN;
      }
      case NULL_CHECK -> {
        return ColumnType.BOOLEAN;
      }
      case PATTERN -> {
        for (ColumnType t : operands) requireType(t, ColumnType.TEXT);
        return ColumnType.BOOLEAN;
      }
      case ARITHMETIC -> {
        for (ColumnType t : operands) {
          if (t != null && !t.isNumeric()) {
            throw new ExprTypeException(id() + " requires numeric operands, got " + t.id());
          }
        }
        if (this == DIV) return ColumnType.REAL;
        ColumnType a = operands.get(0);
        ColumnType b = operands.get(1);
        if (a == null || b == null) return null;
        return ColumnType.widen(a, b);
      }
      case CONVERSION -> {
        return ColumnType.TEXT;
      }
      default -> throw new IllegalStateException("Unhandled operator kind: " + kind);
    }
  }

  private void requireType(ColumnType actual, ColumnType expected) {
    if (actual != null && actual != expected) {
      throw new ExprTypeException(id() + " requires " + expected.id() + " operands, got " + actual.id());
    }
  }
}

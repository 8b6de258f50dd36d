package io.intellixity.reltab.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ColumnType {
  TEXT("text"),
  INTEGER("integer"),
  REAL("real"),
  BOOLEAN("boolean");

  private final String id;

  ColumnType(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() { return id; }

  public boolean isNumeric() {
    return this == INTEGER || this == REAL;
  }

  /**
   * Resolve a type from its external id ("text", "integer", ...).
   *
   * @throws SchemaException if the id is not one of the supported types
   */
  @JsonCreator
  public static ColumnType of(String id) {
    if (id == null) throw new SchemaException("Column type must not be null");
    String k = id.trim().toLowerCase(Locale.ROOT);
    for (ColumnType t : values()) {
      if (t.id.equals(k)) return t;
    }
    throw new SchemaException("Unrecognized column type: '" + id + "'");
  }

  /**
   * Common type of two operands under the numeric widening table (integer widens to real).
   * Returns null when the types are not compatible.
   */
  public static ColumnType widen(ColumnType a, ColumnType b) {
    if (a == b) return a;
    if (a != null && b != null && a.isNumeric() && b.isNumeric()) return REAL;
    return null;
  }

  /** Canonical Java value for this type, or an {@link IllegalArgumentException} if {@code v} does not fit. */
  public Object coerce(Object v) {
    if (v == null) return null;
    return switch (this) {
      case TEXT -> {
        if (v instanceof CharSequence cs) yield cs.toString();
        throw new IllegalArgumentException("Expected text value, got " + v.getClass().getSimpleName());
      }
      case INTEGER -> {
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
          yield ((Number) v).longValue();
        }
        if (v instanceof java.math.BigInteger bi) yield bi.longValueExact();
        if (v instanceof java.math.BigDecimal bd) yield bd.longValueExact();
        throw new IllegalArgumentException("Expected integer value, got " + v.getClass().getSimpleName());
      }
      case REAL -> {
        if (v instanceof Number n) yield n.doubleValue();
        throw new IllegalArgumentException("Expected real value, got " + v.getClass().getSimpleName());
      }
      case BOOLEAN -> {
        if (v instanceof Boolean b) yield b;
        throw new IllegalArgumentException("Expected boolean value, got " + v.getClass().getSimpleName());
      }
    };
  }
}

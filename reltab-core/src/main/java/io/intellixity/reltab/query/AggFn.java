package io.intellixity.reltab.query;

import io.intellixity.reltab.schema.ColumnType;

import java.util.Locale;

/** Aggregation functions available to {@link GroupByQuery}. */
public enum AggFn {
  SUM,
  AVG,
  COUNT,
  MIN,
  MAX,
  /** The group's single distinct non-null value, or null when values differ. */
  UNIQ,
  /** Always null; keeps a column in the grouped schema without computing anything. */
  NULL;

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static AggFn fromId(String id) {
    if (id == null) throw new QueryBuildException("Aggregation function must not be null");
    try {
      return valueOf(id.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryBuildException("Unknown aggregation function: '" + id + "'");
    }
  }

  /** sum for numeric columns, uniq for everything else. */
  public static AggFn defaultFor(ColumnType type) {
    return type.isNumeric() ? SUM : UNIQ;
  }

  public boolean accepts(ColumnType type) {
    return switch (this) {
      case SUM, AVG -> type.isNumeric();
      default -> true;
    };
  }

  public ColumnType resultType(ColumnType input) {
    return switch (this) {
      case AVG -> ColumnType.REAL;
      case COUNT -> ColumnType.INTEGER;
      default -> input;
    };
  }
}

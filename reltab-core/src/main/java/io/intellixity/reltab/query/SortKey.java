package io.intellixity.reltab.query;

import java.util.Objects;

/** One sort key; nulls order as the smallest value. */
public record SortKey(String column, boolean ascending) {
  public SortKey {
    Objects.requireNonNull(column, "column");
  }

  public static SortKey asc(String column) { return new SortKey(column, true); }
  public static SortKey desc(String column) { return new SortKey(column, false); }

  public SortKey withColumn(String column) { return new SortKey(column, ascending); }
}

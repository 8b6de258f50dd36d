package io.intellixity.reltab.query;

import java.util.Objects;

/**
 * One aggregate output of a {@link GroupByQuery}: {@code fn(column)} named {@code column}.
 * A null {@code fn} asks for the column type's default and is resolved when the group-by node is built.
 */
public record AggSpec(AggFn fn, String column) {
  public AggSpec {
    Objects.requireNonNull(column, "column");
  }

  public static AggSpec of(AggFn fn, String column) { return new AggSpec(Objects.requireNonNull(fn, "fn"), column); }

  /** Default aggregation for the column's type. */
  public static AggSpec col(String column) { return new AggSpec(null, column); }
}

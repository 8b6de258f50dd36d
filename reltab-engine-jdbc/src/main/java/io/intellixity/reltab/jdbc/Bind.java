package io.intellixity.reltab.jdbc;

import io.intellixity.reltab.schema.ColumnType;

import java.util.Objects;

/** Positional statement parameter: a canonical value and the column type it is bound as. */
public record Bind(Object value, ColumnType type) {
  public Bind {
    Objects.requireNonNull(type, "type");
  }
}

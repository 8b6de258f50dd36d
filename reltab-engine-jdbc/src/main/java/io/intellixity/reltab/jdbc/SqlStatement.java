package io.intellixity.reltab.jdbc;

import java.util.List;

/** Compiled statement with {@code ?} placeholders; {@link #binds()} are in placeholder order. */
public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
  }
}

package io.intellixity.reltab.jdbc.dialect;

import io.intellixity.reltab.util.ReltabFactoriesLoader;

import java.util.ArrayList;
import java.util.List;

/** Looks up {@link SqlDialect} implementations registered in {@code META-INF/reltab.factories}. */
public final class SqlDialects {
  private SqlDialects() {}

  public static List<SqlDialect> available() {
    return ReltabFactoriesLoader.load(SqlDialect.class);
  }

  /** @throws IllegalArgumentException if no registered dialect has {@code id} */
  public static SqlDialect forId(String id) {
    List<String> ids = new ArrayList<>();
    for (SqlDialect d : available()) {
      if (d.id().equalsIgnoreCase(id)) return d;
      ids.add(d.id());
    }
    throw new IllegalArgumentException("Unknown SQL dialect '" + id + "' (available: " + ids + ")");
  }
}

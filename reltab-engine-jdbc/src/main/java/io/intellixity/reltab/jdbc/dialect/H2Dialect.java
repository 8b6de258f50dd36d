package io.intellixity.reltab.jdbc.dialect;

/** H2 (2.x) dialect. The ANSI rendering in {@link AbstractSqlDialect} runs unchanged. */
public final class H2Dialect extends AbstractSqlDialect {
  @Override public String id() { return "h2"; }
}

package io.intellixity.reltab.exec;

import io.intellixity.reltab.ReltabException;

/**
 * The backing engine rejected or failed a compiled query. {@link #sql()} is the statement that was sent,
 * or null when the failure happened before a statement existed (for example while connecting).
 */
public final class EvalException extends ReltabException {
  private final String sql;

  public EvalException(String message, String sql, Throwable cause) {
    super(message, cause);
    this.sql = sql;
  }

  public String sql() { return sql; }
}

package io.intellixity.reltab.query;

import io.intellixity.reltab.ReltabException;

/**
 * Raised while building a {@link QueryExp} when operator parameters do not fit the child schema(s):
 * unknown or duplicate columns, mismatched concat schemas, colliding derived columns, malformed
 * serialized nodes.
 */
public final class QueryBuildException extends ReltabException {
  public QueryBuildException(String message) {
    super(message);
  }

  public QueryBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.intellixity.reltab.schema;

import io.intellixity.reltab.ReltabException;

/** Raised when a schema is malformed (unknown column type, duplicate or missing column ids). */
public final class SchemaException extends ReltabException {
  public SchemaException(String message) {
    super(message);
  }
}

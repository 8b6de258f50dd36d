package io.intellixity.reltab.exec;

import io.intellixity.reltab.ReltabException;

/** A query could not be rendered for the target engine. */
public final class CompileException extends ReltabException {
  public CompileException(String message) {
    super(message);
  }

  public CompileException(String message, Throwable cause) {
    super(message, cause);
  }
}

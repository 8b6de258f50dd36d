package io.intellixity.reltab.expr;

import io.intellixity.reltab.ReltabException;

/** Raised when expression operand types do not fit their combinator. */
public final class ExprTypeException extends ReltabException {
  public ExprTypeException(String message) {
    super(message);
  }
}

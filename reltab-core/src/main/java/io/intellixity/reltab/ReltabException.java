package io.intellixity.reltab;

/** Base type of every error raised by reltab. */
public class ReltabException extends RuntimeException {
  public ReltabException(String message) {
    super(message);
  }

  public ReltabException(String message, Throwable cause) {
    super(message, cause);
  }
}

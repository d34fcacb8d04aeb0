package com.codeheadsystems.kastell.server.exception;

/**
 * An authentication or token is past its allowed age.
 */
public class TooOldException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "access_denied";

  public TooOldException(String message) {
    super(ERROR, message);
  }

  public TooOldException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

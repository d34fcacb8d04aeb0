package com.codeheadsystems.kastell.server.exception;

/**
 * The session, grant or token has been revoked.
 */
public class RevokedException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_grant";

  public RevokedException(String message) {
    super(ERROR, message);
  }

  public RevokedException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

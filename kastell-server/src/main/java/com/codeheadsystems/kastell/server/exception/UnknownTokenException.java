package com.codeheadsystems.kastell.server.exception;

/**
 * A token value could not be resolved to a session or grant.
 */
public class UnknownTokenException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_grant";

  public UnknownTokenException(String message) {
    super(ERROR, message);
  }

  public UnknownTokenException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

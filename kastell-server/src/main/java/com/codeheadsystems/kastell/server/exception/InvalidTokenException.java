package com.codeheadsystems.kastell.server.exception;

/**
 * A bearer token presented to a protected resource is missing, unknown, expired or revoked.
 */
public class InvalidTokenException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_token";

  public InvalidTokenException(String message) {
    super(ERROR, message);
  }

  public InvalidTokenException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

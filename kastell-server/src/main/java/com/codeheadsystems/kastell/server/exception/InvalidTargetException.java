package com.codeheadsystems.kastell.server.exception;

/**
 * A token exchange names a resource the provider will not issue a token for.
 */
public class InvalidTargetException extends KastellException {

  /**
   * The error code reported for this failure (RFC 8693 §2.2.2).
   */
  public static final String ERROR = "invalid_target";

  public InvalidTargetException(String message) {
    super(ERROR, message);
  }
}

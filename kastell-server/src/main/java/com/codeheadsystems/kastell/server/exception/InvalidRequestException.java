package com.codeheadsystems.kastell.server.exception;

/**
 * The request is malformed or violates a protocol constraint.
 */
public class InvalidRequestException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_request";

  public InvalidRequestException(String message) {
    super(ERROR, message);
  }

  public InvalidRequestException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

package com.codeheadsystems.kastell.server.exception;

/**
 * Client authentication failed.
 */
public class InvalidClientException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_client";

  public InvalidClientException(String message) {
    super(ERROR, message);
  }
}

package com.codeheadsystems.kastell.server.exception;

/**
 * The client id is not registered.
 */
public class UnknownClientException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "unauthorized_client";

  public UnknownClientException(String message) {
    super(ERROR, message);
  }

  public UnknownClientException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

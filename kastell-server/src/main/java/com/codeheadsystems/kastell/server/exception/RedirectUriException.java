package com.codeheadsystems.kastell.server.exception;

/**
 * A redirect URI is missing, unregistered or malformed.
 */
public class RedirectUriException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_request";

  public RedirectUriException(String message) {
    super(ERROR, message);
  }

  public RedirectUriException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

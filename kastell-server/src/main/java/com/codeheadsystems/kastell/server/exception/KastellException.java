package com.codeheadsystems.kastell.server.exception;

/**
 * Base of every protocol failure raised by the provider core.
 * <p>
 * Each subclass carries the OAuth2 / OpenID Connect error code it maps to at the protocol
 * boundary. Adapters render it as {@code {"error": ..., "error_description": ...}}.
 */
public class KastellException extends RuntimeException {

  private final String error;

  public KastellException(String error, String message) {
    super(message);
    this.error = error;
  }

  public KastellException(String error, String message, Throwable cause) {
    super(message, cause);
    this.error = error;
  }

  /**
   * The OAuth2 error code.
   *
   * @return the error code
   */
  public String error() {
    return error;
  }
}

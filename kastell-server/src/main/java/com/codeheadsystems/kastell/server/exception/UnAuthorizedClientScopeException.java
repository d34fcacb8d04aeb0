package com.codeheadsystems.kastell.server.exception;

/**
 * The request asks for a scope the client may not use.
 */
public class UnAuthorizedClientScopeException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_scope";

  public UnAuthorizedClientScopeException(String message) {
    super(ERROR, message);
  }

  public UnAuthorizedClientScopeException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

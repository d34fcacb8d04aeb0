package com.codeheadsystems.kastell.server.exception;

/**
 * The base token's usage rules do not allow minting the requested token type.
 */
public class MintingNotAllowedException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "invalid_grant";

  public MintingNotAllowedException(String message) {
    super(ERROR, message);
  }

  public MintingNotAllowedException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

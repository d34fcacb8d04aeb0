package com.codeheadsystems.kastell.server.exception;

/**
 * A collaborator (remote fetch, store) failed.
 */
public class ServiceException extends KastellException {

  /**
   * The error code reported for this failure.
   */
  public static final String ERROR = "server_error";

  public ServiceException(String message) {
    super(ERROR, message);
  }

  public ServiceException(String message, Throwable cause) {
    super(ERROR, message, cause);
  }
}

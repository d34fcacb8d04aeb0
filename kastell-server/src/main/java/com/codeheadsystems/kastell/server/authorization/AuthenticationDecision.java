package com.codeheadsystems.kastell.server.authorization;

/**
 * What the flow concluded about the user agent's existing authentication.
 */
public interface AuthenticationDecision {

  /**
   * An authenticated session can answer the request.
   *
   * @param sessionId the grant's session id
   */
  record Proceed(String sessionId) implements AuthenticationDecision {
  }

  /**
   * The user has to (re-)authenticate.
   *
   * @param reason why, for the log
   */
  record NeedsAuthentication(String reason) implements AuthenticationDecision {
  }

  /**
   * Authentication is needed but not allowed, e.g. under {@code prompt=none}.
   *
   * @param error       OAuth2 error code
   * @param description description
   */
  record Denied(String error, String description) implements AuthenticationDecision {
  }
}

package com.codeheadsystems.kastell.server.authn;

import com.codeheadsystems.kastell.server.exception.TooOldException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * A way of authenticating the end user. The provider core never renders a login page; it
 * hands off to the method and expects the host to call back once {@link #verify} succeeded.
 */
public interface AuthenticationMethod {

  /**
   * The authentication context class reference this method satisfies.
   *
   * @return the ACR
   */
  String acr();

  /**
   * How long an authentication by this method stays valid, null for the provider default.
   *
   * @return the lifetime
   */
  default Duration expiresIn() {
    return null;
  }

  /**
   * Recognizes a user agent that already authenticated.
   *
   * @param cookieHeader  the raw {@code Cookie} header, may be null
   * @param maxAgeSeconds reject authentications older than this, null for no limit
   * @return the identity, or empty if the user agent is not authenticated
   * @throws TooOldException   if the authentication is older than {@code maxAgeSeconds}
   * @throws SecurityException if the session cookie was tampered with
   */
  Optional<AuthenticatedIdentity> authenticatedAs(String cookieHeader, Long maxAgeSeconds);

  /**
   * Completes an authentication from the parameters the login step posted.
   *
   * @param parameters the posted parameters
   * @return the authenticated user id, or empty if authentication failed
   */
  Optional<String> verify(Map<String, String> parameters);
}

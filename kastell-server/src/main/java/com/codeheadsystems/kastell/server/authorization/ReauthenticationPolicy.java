package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.authn.AuthenticationMethod;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;

/**
 * Decides whether a user with a usable session must authenticate again anyway.
 */
@FunctionalInterface
public interface ReauthenticationPolicy {

  /**
   * Never forces a new authentication.
   */
  ReauthenticationPolicy NEVER = (request, method) -> false;

  /**
   * Forces a new authentication when the request carries {@code prompt=login}.
   */
  ReauthenticationPolicy PROMPT_LOGIN = (request, method) -> request.hasPrompt("login");

  boolean reauthenticate(AuthorizationRequest request, AuthenticationMethod method);
}

package com.codeheadsystems.kastell.dropwizard.auth;

import java.security.Principal;
import java.util.List;

/**
 * Principal behind a valid Kastell access token.
 *
 * @param userId   the authenticated end user
 * @param clientId the client the token was issued to
 * @param scope    the scopes granted to the token
 */
public record KastellPrincipal(String userId, String clientId, List<String> scope)
    implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}

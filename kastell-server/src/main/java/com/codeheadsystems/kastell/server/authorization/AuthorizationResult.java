package com.codeheadsystems.kastell.server.authorization;

import java.util.Map;

/**
 * Outcome of one pass through the {@link AuthorizationFlow}.
 */
public interface AuthorizationResult {

  AuthorizationState state();

  /**
   * The response to deliver to the client.
   *
   * @param response the response
   */
  record Completed(AuthorizationResponse response) implements AuthorizationResult {
    @Override
    public AuthorizationState state() {
      return AuthorizationState.RESPONSE_BUILT;
    }
  }

  /**
   * The user has to authenticate first. The host runs the method and comes back through
   * {@link AuthorizationFlow#resume}.
   *
   * @param methodId  id of the authentication method in the broker
   * @param arguments what the method needs: {@code authn_class_ref}, {@code return_uri},
   *                  {@code query} and, when known, client and request display hints
   */
  record AuthenticationRequired(String methodId, Map<String, String> arguments)
      implements AuthorizationResult {

    public AuthenticationRequired {
      arguments = Map.copyOf(arguments);
    }

    @Override
    public AuthorizationState state() {
      return AuthorizationState.AUTHENTICATING;
    }
  }

  /**
   * The request failed.
   *
   * @param error       OAuth2 error code
   * @param description human readable description
   * @param returnUri   where the error may be reported, null when the redirect URI itself is
   *                    unusable and the error must be shown to the user agent instead
   * @param response    the error response for {@code returnUri}, null when there is none
   */
  record Failed(String error, String description, String returnUri,
                AuthorizationResponse response) implements AuthorizationResult {
    @Override
    public AuthorizationState state() {
      return AuthorizationState.ERROR;
    }
  }
}

package com.codeheadsystems.kastell.server.authorization;

/**
 * Where an authorization request stands.
 */
public enum AuthorizationState {
  RECEIVED,
  VALIDATED,
  AUTHENTICATING,
  AUTHENTICATED,
  RESPONSE_BUILT,
  ERROR
}

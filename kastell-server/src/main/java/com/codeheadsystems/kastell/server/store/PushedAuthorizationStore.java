package com.codeheadsystems.kastell.server.store;

import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import java.time.Instant;
import java.util.Optional;

/**
 * Holds pushed authorization requests until they are used once or expire.
 */
public interface PushedAuthorizationStore {

  /**
   * Stores a request under its {@code urn:uuid:} reference.
   *
   * @param requestUri the reference handed to the client
   * @param request    the validated request
   * @param expiresAt  after this instant the reference no longer resolves
   */
  void store(String requestUri, AuthorizationRequest request, Instant expiresAt);

  /**
   * Removes and returns the request. A second call with the same reference returns empty.
   *
   * @param requestUri the reference
   * @param now        the current time, expired entries resolve as missing
   * @return the request, or empty if unknown, already used or expired
   */
  Optional<AuthorizationRequest> take(String requestUri, Instant now);
}

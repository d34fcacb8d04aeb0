package com.codeheadsystems.kastell.model.par;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pushed authorization request response (RFC 9126 §2.2).
 * <p>
 * Used by: {@code POST /par} response
 *
 * @param requestUri one-time {@code urn:uuid:} reference to the stored request
 * @param expiresIn  seconds until the stored request is discarded
 */
public record PushedAuthorizationResponse(
    @JsonProperty("request_uri") String requestUri,
    @JsonProperty("expires_in") long expiresIn) {
}

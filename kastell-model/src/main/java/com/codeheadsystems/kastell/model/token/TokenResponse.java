package com.codeheadsystems.kastell.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful token endpoint response (RFC 6749 §5.1, OpenID Connect Core §3.1.3.3).
 * <p>
 * Used by: {@code POST /token} response
 *
 * @param accessToken  the issued access token
 * @param tokenType    always {@code Bearer}
 * @param expiresIn    access token lifetime in seconds, may be null when unbounded
 * @param refreshToken refresh token, present only when the grant allows minting one
 * @param idToken      ID token, present only when {@code openid} was granted
 * @param scope           space separated granted scope
 * @param issuedTokenType type URI of the issued token, only set for token exchange (RFC 8693 §2.2.1)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("id_token") String idToken,
    @JsonProperty("scope") String scope,
    @JsonProperty("issued_token_type") String issuedTokenType) {

  /**
   * The bearer token type.
   */
  public static final String BEARER = "Bearer";

  public TokenResponse(String accessToken, String tokenType, Long expiresIn, String refreshToken,
                       String idToken, String scope) {
    this(accessToken, tokenType, expiresIn, refreshToken, idToken, scope, null);
  }
}

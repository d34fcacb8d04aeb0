package com.codeheadsystems.kastell.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Token introspection response (RFC 7662 §2.2). An inactive token is reported with
 * {@code active=false} and nothing else.
 * <p>
 * Used by: {@code POST /introspection} response
 *
 * @param active    whether the token is currently active
 * @param scope     space separated scope of the token's grant
 * @param clientId  the client the token was issued to
 * @param tokenType {@code Bearer} for access tokens, {@code refresh_token} for refresh tokens
 * @param exp       expiry, seconds since the epoch
 * @param iat       issue time, seconds since the epoch
 * @param sub       the subject as the client knows it
 * @param aud       the resources the token may be presented to
 * @param iss       the issuer
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IntrospectionResponse(
    @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("active") boolean active,
    @JsonProperty("scope") String scope,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("exp") Long exp,
    @JsonProperty("iat") Long iat,
    @JsonProperty("sub") String sub,
    @JsonProperty("aud") List<String> aud,
    @JsonProperty("iss") String iss) {

  public static IntrospectionResponse inactive() {
    return new IntrospectionResponse(false, null, null, null, null, null, null, null, null);
  }
}

package com.codeheadsystems.kastell.server.endpoint;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A parsed token endpoint request.
 *
 * @param grantType        {@code authorization_code}, {@code refresh_token} or the token exchange URN
 * @param code             the authorization code
 * @param redirectUri      the redirect_uri sent with the authorization request
 * @param refreshToken     the refresh token
 * @param subjectToken     the token offered for exchange
 * @param subjectTokenType type URI of the subject token
 * @param resource         the target the exchanged token is for, may be null
 * @param scope            scope asked for in an exchange, must lie within the exchange grant's
 */
public record TokenRequest(String grantType, String code, String redirectUri,
                           String refreshToken, String subjectToken, String subjectTokenType,
                           String resource, List<String> scope) {

  public static final String AUTHORIZATION_CODE = "authorization_code";
  public static final String REFRESH_TOKEN = "refresh_token";
  public static final String TOKEN_EXCHANGE = "urn:ietf:params:oauth:grant-type:token-exchange";
  public static final String ACCESS_TOKEN_TYPE = "urn:ietf:params:oauth:token-type:access_token";

  /**
   * Reads a token request from form parameters.
   *
   * @param params the form parameters
   * @return the request
   * @throws InvalidRequestException if grant_type or the value it needs is missing
   */
  public static TokenRequest from(Map<String, String> params) {
    String grantType = params.get("grant_type");
    if (grantType == null || grantType.isBlank()) {
      throw new InvalidRequestException("Missing grant_type");
    }
    String scope = params.get("scope");
    TokenRequest request = new TokenRequest(grantType, params.get("code"),
        params.get("redirect_uri"), params.get("refresh_token"), params.get("subject_token"),
        params.get("subject_token_type"), params.get("resource"),
        isBlank(scope) ? List.of() : Arrays.asList(scope.trim().split("\\s+")));
    if (AUTHORIZATION_CODE.equals(grantType) && isBlank(request.code())) {
      throw new InvalidRequestException("Missing code");
    }
    if (REFRESH_TOKEN.equals(grantType) && isBlank(request.refreshToken())) {
      throw new InvalidRequestException("Missing refresh_token");
    }
    if (TOKEN_EXCHANGE.equals(grantType)) {
      if (isBlank(request.subjectToken()) || isBlank(request.subjectTokenType())) {
        throw new InvalidRequestException("Missing subject_token or subject_token_type");
      }
      if (!ACCESS_TOKEN_TYPE.equals(request.subjectTokenType())) {
        throw new InvalidRequestException("Unsupported subject_token_type: "
            + request.subjectTokenType());
      }
    }
    return request;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
